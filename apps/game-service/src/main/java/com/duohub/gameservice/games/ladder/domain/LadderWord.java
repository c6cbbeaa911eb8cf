package com.duohub.gameservice.games.ladder.domain;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.MovePayload;

import java.util.Locale;

/**
 * 单词阶梯走子：提交下一个单词。
 */
public record LadderWord(String word) implements MovePayload {

    public LadderWord {
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("MISSING_WORD");
        }
        word = word.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public GameKind kind() {
        return GameKind.LADDER;
    }

    @Override
    public String fingerprint() {
        return "word:" + word;
    }
}
