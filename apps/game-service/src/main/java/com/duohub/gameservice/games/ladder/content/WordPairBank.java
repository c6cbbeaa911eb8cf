package com.duohub.gameservice.games.ladder.content;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 内置题库。前三道用于一对情侣的初始三局，其余用于补局随机抽取。
 */
public class WordPairBank {

    private static final List<WordPair> PAIRS = List.of(
            new WordPair("cat-dog", "CAT", "DOG", "en", 3),
            new WordPair("cold-warm", "COLD", "WARM", "en", 4),
            new WordPair("less-more", "LESS", "MORE", "en", 4),
            new WordPair("head-tail", "HEAD", "TAIL", "en", 5),
            new WordPair("work-play", "WORK", "PLAY", "en", 6),
            new WordPair("hate-love", "HATE", "LOVE", "en", 3)
    );

    private final Random random;

    public WordPairBank(Random random) {
        this.random = random;
    }

    public List<WordPair> initialPairs() {
        return PAIRS.subList(0, 3);
    }

    public List<WordPair> all() {
        return PAIRS;
    }

    /**
     * 随机取一道题，尽量避开当前在玩的题目
     */
    public WordPair randomPair(Set<String> excludeIds) {
        List<WordPair> candidates = PAIRS.stream()
                .filter(p -> excludeIds == null || !excludeIds.contains(p.id()))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            candidates = PAIRS;
        }
        return candidates.get(random.nextInt(candidates.size()));
    }
}
