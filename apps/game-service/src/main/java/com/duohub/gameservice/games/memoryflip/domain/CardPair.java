package com.duohub.gameservice.games.memoryflip.domain;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.MovePayload;

/**
 * 翻开的两张牌；指纹与顺序无关。
 */
public record CardPair(String card1Id, String card2Id) implements MovePayload {

    public CardPair {
        if (card1Id == null || card2Id == null) {
            throw new IllegalArgumentException("MISSING_CARD_ID");
        }
    }

    @Override
    public GameKind kind() {
        return GameKind.MEMORY_FLIP;
    }

    @Override
    public String fingerprint() {
        return card1Id.compareTo(card2Id) <= 0
                ? "pair:" + card1Id + "+" + card2Id
                : "pair:" + card2Id + "+" + card1Id;
    }
}
