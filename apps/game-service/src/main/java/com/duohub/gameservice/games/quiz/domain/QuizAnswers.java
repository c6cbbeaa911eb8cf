package com.duohub.gameservice.games.quiz.domain;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.MovePayload;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一次性提交的全部答案。
 */
public record QuizAnswers(List<Integer> answers) implements MovePayload {

    public QuizAnswers {
        if (answers == null) {
            throw new IllegalArgumentException("MISSING_ANSWERS");
        }
        answers = List.copyOf(answers);
    }

    @Override
    public GameKind kind() {
        return GameKind.QUIZ;
    }

    @Override
    public String fingerprint() {
        return "answers:" + answers.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
