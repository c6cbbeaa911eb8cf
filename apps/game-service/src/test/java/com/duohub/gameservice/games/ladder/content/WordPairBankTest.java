package com.duohub.gameservice.games.ladder.content;

import com.duohub.gameservice.games.ladder.domain.ClasspathWordVocabulary;
import com.duohub.gameservice.games.ladder.domain.WordVocabulary;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class WordPairBankTest {

    private final WordPairBank bank = new WordPairBank(new Random(7));

    @Test
    void initialPairsAreTheFirstThree() {
        assertThat(bank.initialPairs()).extracting(WordPair::id)
                .containsExactly("cat-dog", "cold-warm", "less-more");
    }

    @Test
    void randomPairAvoidsExcluded() {
        Set<String> allButOne = bank.all().stream().map(WordPair::id)
                .filter(id -> !id.equals("hate-love")).collect(Collectors.toSet());
        for (int i = 0; i < 20; i++) {
            assertThat(bank.randomPair(allButOne).id()).isEqualTo("hate-love");
        }
    }

    @Test
    void randomPairFallsBackWhenEverythingExcluded() {
        Set<String> all = bank.all().stream().map(WordPair::id).collect(Collectors.toSet());
        assertThat(bank.randomPair(all)).isNotNull();
    }

    @Test
    void everyPairIsSolvableInItsOptimalStepsWithShippedVocabulary() throws Exception {
        Set<String> words = shippedWords();
        WordVocabulary vocabulary = new ClasspathWordVocabulary();
        for (WordPair pair : bank.all()) {
            assertThat(vocabulary.contains("en", pair.startWord())).as(pair.id()).isTrue();
            assertThat(shortestPath(pair.startWord(), pair.endWord(), words)).as(pair.id())
                    .isEqualTo(pair.optimalSteps());
        }
    }

    private static Set<String> shippedWords() throws Exception {
        Set<String> words = new HashSet<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(
                WordPairBankTest.class.getClassLoader().getResourceAsStream("words/en.txt"), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                if (!line.isBlank() && !line.startsWith("#")) words.add(line.trim().toUpperCase());
            }
        }
        return words;
    }

    private static Integer shortestPath(String from, String to, Set<String> words) {
        Set<String> graph = new HashSet<>(words);
        graph.add(to);
        Map<String, Integer> dist = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        dist.put(from, 0);
        queue.add(from);
        while (!queue.isEmpty()) {
            String w = queue.poll();
            for (String next : graph) {
                if (!dist.containsKey(next) && oneEdit(w, next)) {
                    dist.put(next, dist.get(w) + 1);
                    queue.add(next);
                }
            }
        }
        return dist.get(to);
    }

    private static boolean oneEdit(String a, String b) {
        if (a.length() == b.length()) {
            int diff = 0;
            for (int i = 0; i < a.length(); i++) {
                if (a.charAt(i) != b.charAt(i)) diff++;
            }
            return diff == 1;
        }
        if (Math.abs(a.length() - b.length()) != 1) return false;
        String longer = a.length() > b.length() ? a : b;
        String shorter = a.length() > b.length() ? b : a;
        for (int i = 0; i < longer.length(); i++) {
            if ((longer.substring(0, i) + longer.substring(i + 1)).equals(shorter)) return true;
        }
        return false;
    }
}
