package com.duohub.gameservice.games.quiz.content;

import java.time.LocalDate;
import java.util.List;

/**
 * 每日问答题目来源：按日期轮换，两台设备对同一天算出同一份题目。
 */
public class QuizContentSource {

    public record QuizSpec(String quizId, int questionCount) {
    }

    private static final List<String> QUIZZES = List.of(
            "first-date", "dream-trip", "comfort-food", "weekend-plan", "love-language");

    private final int questionCount;

    public QuizContentSource(int questionCount) {
        this.questionCount = questionCount;
    }

    public QuizSpec forDay(LocalDate day) {
        int idx = (int) Math.floorMod(day.toEpochDay(), QUIZZES.size());
        return new QuizSpec(QUIZZES.get(idx) + "@" + day, questionCount);
    }
}
