package com.duohub.gameservice.games.session.service;

import com.duohub.gameservice.games.session.application.PollHandle;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.Move;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 会话状态机对外接口（在某一台设备上执行，self 即本设备用户）。
 */
public interface GameSessionService {

    /**
     * 打开每日单例游戏（问答 / 翻牌）：已有则返回，没有则按仲裁规则创建
     */
    CompletableFuture<GameSession> openSession(String self, String partner, GameKind kind);

    /**
     * 返回该对情侣进行中的单词阶梯；从未开过时按 创建方、等待方、创建方 的先手顺序建立初始三局
     */
    CompletableFuture<List<GameSession>> ensureLadders(String self, String partner);

    MoveOutcome submitMove(Move move);

    /**
     * 单词阶梯：当前回合者让出回合
     */
    GameSession yieldTurn(String sessionId, String participant);

    GameSession getSession(String sessionId);

    /**
     * 本地没有时尝试从权威后端恢复
     */
    GameSession locateSession(GameKind kind, String sessionId);

    List<GameSession> listSessions(String pairKey, GameKind kind);

    boolean hasUserAnswered(String sessionId, String userId);

    /**
     * 重新结算已完成会话的完成奖励；已记账的档位不会重复发放
     *
     * @return 本次新记账的 tierKey
     */
    List<String> settleCompletion(String sessionId);

    PollHandle watchPair(String self, String partner);

    void unwatchPair(String self, String partner);
}
