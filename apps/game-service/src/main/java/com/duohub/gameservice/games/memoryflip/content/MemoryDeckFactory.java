package com.duohub.gameservice.games.memoryflip.content;

import com.duohub.gameservice.games.memoryflip.domain.MemoryCard;
import com.duohub.gameservice.games.memoryflip.domain.MemoryFlipState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * 生成洗好的一副牌。牌面和配对关系由创建方决定，随会话同步给对方。
 */
public class MemoryDeckFactory {

    private static final List<String> EMOJIS = List.of(
            "❤️", "🌹", "🍫", "💌", "🎁", "🌙", "⭐", "🍰", "🎵", "🐱", "🌈", "☕");

    private static final List<String> QUOTES = List.of(
            "Together is a wonderful place to be.",
            "You are my favorite notification.",
            "Every day with you is my favorite day.");

    private final Random random;
    private final int pairs;

    public MemoryDeckFactory(Random random, int pairs) {
        if (pairs <= 0 || pairs > EMOJIS.size()) {
            throw new IllegalArgumentException("pairs must be within 1.." + EMOJIS.size());
        }
        this.random = random;
        this.pairs = pairs;
    }

    public MemoryFlipState newDeck() {
        List<MemoryCard> cards = new ArrayList<>();
        for (int i = 0; i < pairs; i++) {
            String pairId = "pair-" + i;
            String emoji = EMOJIS.get(i);
            cards.add(new MemoryCard(UUID.randomUUID().toString(), 0, emoji, pairId, MemoryCard.Status.HIDDEN, null, null));
            cards.add(new MemoryCard(UUID.randomUUID().toString(), 0, emoji, pairId, MemoryCard.Status.HIDDEN, null, null));
        }
        Collections.shuffle(cards, random);
        for (int i = 0; i < cards.size(); i++) {
            cards.get(i).setPosition(i);
        }
        MemoryFlipState state = new MemoryFlipState();
        state.setCards(cards);
        state.setTotalPairs(pairs);
        state.setMatchedPairs(0);
        state.setCompletionQuote(QUOTES.get(random.nextInt(QUOTES.size())));
        return state;
    }
}
