package com.duohub.gameservice.games.session.domain.model;

/**
 * 各游戏的会话载荷（按 kind 区分的标签联合）。
 * 实现类必须是扁平、可合并的结构，不允许出现可变的嵌套环。
 */
public interface SessionState {

    /** 该载荷属于哪种游戏 */
    GameKind kind();

    /** 深拷贝：推测性修改只作用在副本上 */
    SessionState copy();
}
