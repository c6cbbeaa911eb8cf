package com.duohub.gameservice.games.quiz.domain;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.SessionState;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 默契问答载荷：两人各自作答一次，全部作答后计算默契度。
 */
@Data
@NoArgsConstructor
public class QuizState implements SessionState {
    private String quizId;
    private int questionCount;
    /** 参与者 -> 选项下标 */
    private Map<String, List<Integer>> answers = new LinkedHashMap<>();
    /** 默契度（0~100），两人都作答后写入 */
    private Integer matchPercentage;

    public static QuizState start(String quizId, int questionCount) {
        QuizState s = new QuizState();
        s.quizId = quizId;
        s.questionCount = questionCount;
        return s;
    }

    @Override
    public GameKind kind() {
        return GameKind.QUIZ;
    }

    public boolean hasAnswered(String userId) {
        return answers.containsKey(userId);
    }

    @Override
    public QuizState copy() {
        QuizState c = new QuizState();
        c.quizId = quizId;
        c.questionCount = questionCount;
        answers.forEach((k, v) -> c.answers.put(k, new ArrayList<>(v)));
        c.matchPercentage = matchPercentage;
        return c;
    }
}
