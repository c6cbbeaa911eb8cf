package com.duohub.gameservice.games.memoryflip.domain;

import com.duohub.gameservice.games.session.domain.model.GameKind;
import com.duohub.gameservice.games.session.domain.model.SessionState;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 记忆翻牌载荷。
 */
@Data
@NoArgsConstructor
public class MemoryFlipState implements SessionState {
    private List<MemoryCard> cards = new ArrayList<>();
    private int totalPairs;
    private int matchedPairs;
    private String completionQuote;

    @Override
    public GameKind kind() {
        return GameKind.MEMORY_FLIP;
    }

    public Optional<MemoryCard> card(String cardId) {
        return cards.stream().filter(c -> c.getId().equals(cardId)).findFirst();
    }

    @Override
    public MemoryFlipState copy() {
        MemoryFlipState c = new MemoryFlipState();
        for (MemoryCard card : cards) {
            c.cards.add(card.copy());
        }
        c.totalPairs = totalPairs;
        c.matchedPairs = matchedPairs;
        c.completionQuote = completionQuote;
        return c;
    }
}
