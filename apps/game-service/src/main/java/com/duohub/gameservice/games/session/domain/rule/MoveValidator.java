package com.duohub.gameservice.games.session.domain.rule;

import com.duohub.gameservice.games.session.domain.model.MovePayload;
import com.duohub.gameservice.games.session.domain.model.SessionState;

/**
 * 走子校验器：纯函数，不修改状态、不做 IO。
 * 回合与参与者检查由状态机负责，这里只看载荷本身是否合规。
 */
@FunctionalInterface
public interface MoveValidator<S extends SessionState, P extends MovePayload> {

    MoveVerdict validate(S state, P payload, String submitter);
}
