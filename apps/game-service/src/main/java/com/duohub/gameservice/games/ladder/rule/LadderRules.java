package com.duohub.gameservice.games.ladder.rule;

import com.duohub.gameservice.games.ladder.domain.LadderState;
import com.duohub.gameservice.games.ladder.domain.LadderWord;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.rule.GameRules;
import com.duohub.gameservice.games.session.domain.rule.MoveValidator;

import java.util.OptionalInt;

/**
 * 单词阶梯规则：严格轮流，可让步，走到目标词即完成。
 * 质量指标 = 实际步数 - 最优步数（≤0 即最优）。
 */
public class LadderRules implements GameRules<LadderState, LadderWord> {

    private final LadderMoveValidator validator;

    public LadderRules(LadderMoveValidator validator) {
        this.validator = validator;
    }

    @Override
    public GameKind kind() {
        return GameKind.LADDER;
    }

    @Override
    public Class<LadderState> stateType() {
        return LadderState.class;
    }

    @Override
    public Class<LadderWord> payloadType() {
        return LadderWord.class;
    }

    @Override
    public MoveValidator<LadderState, LadderWord> validator() {
        return validator;
    }

    @Override
    public void apply(LadderState state, LadderWord payload, String submitter, long now) {
        state.getWordChain().add(payload.word());
    }

    @Override
    public boolean isComplete(LadderState state) {
        return state.tail().equals(state.getEndWord());
    }

    @Override
    public OptionalInt qualityMetric(LadderState state, GameSession session) {
        if (state.getOptimalSteps() == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(state.stepCount() - state.getOptimalSteps());
    }

    @Override
    public String nextTurnOwner(GameSession session, String submitter) {
        return session.partnerOf(submitter);
    }

    @Override
    public boolean supportsYield() {
        return true;
    }

    @Override
    public void onYield(LadderState state, String participant, long now) {
        state.setYieldedBy(participant);
        state.setYieldedAt(now);
        state.setYieldCount(state.getYieldCount() + 1);
    }

    @Override
    public void onTurnResumed(LadderState state) {
        state.setYieldedBy(null);
        state.setYieldedAt(null);
    }

    @Override
    public String summary(LadderState state) {
        return state.getStartWord() + " → " + state.getEndWord() + "：" + state.tail()
                + "（第 " + state.stepCount() + " 步）";
    }
}
