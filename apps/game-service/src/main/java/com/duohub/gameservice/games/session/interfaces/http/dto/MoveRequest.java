package com.duohub.gameservice.games.session.interfaces.http.dto;

import com.duohub.gameservice.games.ladder.domain.LadderWord;
import com.duohub.gameservice.games.memoryflip.domain.CardPair;
import com.duohub.gameservice.games.quiz.domain.QuizAnswers;
import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.MovePayload;
import lombok.Data;

import java.util.List;

/**
 * 走子请求：按会话种类取对应字段。
 * ladder → word；quiz → answers；memory-flip → card1Id + card2Id
 */
@Data
public class MoveRequest {
    /** 客户端生成的请求ID，仅用于追踪 */
    private String moveId;
    private String word;
    private List<Integer> answers;
    private String card1Id;
    private String card2Id;

    public MovePayload toPayload(GameKind kind) {
        switch (kind) {
            case LADDER:
                return new LadderWord(word);
            case QUIZ:
                return new QuizAnswers(answers);
            case MEMORY_FLIP:
                return new CardPair(card1Id, card2Id);
            default:
                throw new IllegalArgumentException("UNKNOWN_KIND: " + kind);
        }
    }
}
