package com.duohub.gameservice.games.quiz.rule;

import com.duohub.gameservice.games.quiz.domain.QuizAnswers;
import com.duohub.gameservice.games.quiz.domain.QuizState;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.rule.GameRules;
import com.duohub.gameservice.games.session.domain.rule.MoveValidator;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 默契问答规则：
 * - 开局不限先后（回合为 null），第一人作答后回合交给未作答的一方；
 * - 两人都作答即完成，默契度 = 相同答案数 / 题目数（四舍五入到整数百分比）。
 */
public class QuizRules implements GameRules<QuizState, QuizAnswers> {

    private final QuizMoveValidator validator = new QuizMoveValidator();

    @Override
    public GameKind kind() {
        return GameKind.QUIZ;
    }

    @Override
    public Class<QuizState> stateType() {
        return QuizState.class;
    }

    @Override
    public Class<QuizAnswers> payloadType() {
        return QuizAnswers.class;
    }

    @Override
    public MoveValidator<QuizState, QuizAnswers> validator() {
        return validator;
    }

    @Override
    public void apply(QuizState state, QuizAnswers payload, String submitter, long now) {
        state.getAnswers().put(submitter, new ArrayList<>(payload.answers()));
        if (state.getAnswers().size() >= 2) {
            state.setMatchPercentage(matchPercentage(state));
        }
    }

    @Override
    public boolean isComplete(QuizState state) {
        return state.getAnswers().size() >= 2;
    }

    @Override
    public OptionalInt qualityMetric(QuizState state, GameSession session) {
        return state.getMatchPercentage() == null ? OptionalInt.empty() : OptionalInt.of(state.getMatchPercentage());
    }

    @Override
    public String initialTurnOwner(GameSession session, String firstTurn) {
        return null;
    }

    @Override
    public String nextTurnOwner(GameSession session, String submitter) {
        return session.partnerOf(submitter);
    }

    @Override
    public Optional<RejectReason> outOfTurnReason(QuizState state, String submitter) {
        return state.hasAnswered(submitter) ? Optional.of(RejectReason.ALREADY_ANSWERED) : Optional.empty();
    }

    @Override
    public String summary(QuizState state) {
        if (state.getMatchPercentage() != null) {
            return "默契问答完成，默契度 " + state.getMatchPercentage() + "%";
        }
        return "对方已完成默契问答，等你作答";
    }

    static int matchPercentage(QuizState state) {
        List<List<Integer>> both = new ArrayList<>(state.getAnswers().values());
        List<Integer> a = both.get(0);
        List<Integer> b = both.get(1);
        int total = state.getQuestionCount();
        if (total <= 0) return 0;
        int same = 0;
        for (int i = 0; i < total && i < a.size() && i < b.size(); i++) {
            if (a.get(i).equals(b.get(i))) same++;
        }
        return Math.round(same * 100f / total);
    }
}
