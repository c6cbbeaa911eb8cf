package com.duohub.gameservice.games.quiz.rule;

import com.duohub.gameservice.games.quiz.domain.QuizAnswers;
import com.duohub.gameservice.games.quiz.domain.QuizState;
import com.duohub.gameservice.games.session.domain.rule.MoveValidator;
import com.duohub.gameservice.games.session.domain.rule.MoveVerdict;
import com.duohub.gameservice.games.session.domain.rule.RejectReason;

/**
 * 答案数量必须等于题目数；每人只能作答一次，重复提交拒绝而不是覆盖。
 */
public class QuizMoveValidator implements MoveValidator<QuizState, QuizAnswers> {

    @Override
    public MoveVerdict validate(QuizState state, QuizAnswers payload, String submitter) {
        if (state.hasAnswered(submitter)) {
            return MoveVerdict.reject(RejectReason.ALREADY_ANSWERED);
        }
        if (payload.answers().size() != state.getQuestionCount()) {
            return MoveVerdict.reject(RejectReason.WRONG_ANSWER_COUNT);
        }
        return MoveVerdict.VALID;
    }
}
