package com.duohub.gameservice.games.session.domain.rule;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.MovePayload;
import com.duohub.gameservice.games.session.domain.model.SessionState;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * 单个游戏的规则插件：校验、折叠、完成判定、质量指标、回合归属。
 * 状态机只依赖这个接口，新增游戏时注册一个实现即可。
 *
 * @param <S> 会话载荷类型
 * @param <P> 走子载荷类型
 */
public interface GameRules<S extends SessionState, P extends MovePayload> {

    GameKind kind();

    Class<S> stateType();

    Class<P> payloadType();

    MoveValidator<S, P> validator();

    /**
     * 把已通过校验的走子折叠进载荷（原地修改副本）
     */
    void apply(S state, P payload, String submitter, long now);

    boolean isComplete(S state);

    /**
     * 奖励档位表使用的质量指标；没有指标时返回 empty
     */
    OptionalInt qualityMetric(S state, GameSession session);

    /**
     * 合法走子后的回合归属；返回 null 表示不限回合
     */
    String nextTurnOwner(GameSession session, String submitter);

    /**
     * 会话创建时的回合归属
     */
    default String initialTurnOwner(GameSession session, String firstTurn) {
        return firstTurn;
    }

    /**
     * 非当前回合者提交时，若属于本游戏的规则性拒绝（而非抢回合），返回原因码；
     * 默认 empty，由状态机报 NOT_YOUR_TURN
     */
    default Optional<RejectReason> outOfTurnReason(S state, String submitter) {
        return Optional.empty();
    }

    default boolean supportsYield() {
        return false;
    }

    /**
     * 记录让步；只有 {@link #supportsYield()} 的游戏会被调用
     */
    default void onYield(S state, String participant, long now) {
        throw new UnsupportedOperationException("yield not supported for " + kind());
    }

    /**
     * 让步后的下一步合法走子会调用，用于清掉让步标记
     */
    default void onTurnResumed(S state) {
    }

    /**
     * 通知里的一句话摘要
     */
    String summary(S state);
}
