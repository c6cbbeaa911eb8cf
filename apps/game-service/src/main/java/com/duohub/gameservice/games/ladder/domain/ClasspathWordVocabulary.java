package com.duohub.gameservice.games.ladder.domain;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 从 classpath 的 words/{language}.txt 读取词表，每行一个单词，# 开头为注释。
 * 首次访问某语言时加载并缓存。
 */
@Slf4j
public class ClasspathWordVocabulary implements WordVocabulary {

    private final Map<String, Set<String>> byLanguage = new ConcurrentHashMap<>();
    private final ClassLoader classLoader;

    public ClasspathWordVocabulary() {
        this(ClasspathWordVocabulary.class.getClassLoader());
    }

    public ClasspathWordVocabulary(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public boolean contains(String language, String word) {
        if (word == null || word.isBlank()) return false;
        String lang = language == null ? "en" : language.toLowerCase(Locale.ROOT);
        return byLanguage.computeIfAbsent(lang, this::load).contains(word.trim().toUpperCase(Locale.ROOT));
    }

    private Set<String> load(String language) {
        String path = "words/" + language + ".txt";
        try (InputStream in = classLoader.getResourceAsStream(path)) {
            if (in == null) {
                log.warn("词表不存在，按空词表处理: {}", path);
                return Collections.emptySet();
            }
            Set<String> words = new HashSet<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String w = line.trim();
                    if (w.isEmpty() || w.startsWith("#")) continue;
                    words.add(w.toUpperCase(Locale.ROOT));
                }
            }
            log.info("词表加载完成: language={}, size={}", language, words.size());
            return Collections.unmodifiableSet(words);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load " + path, e);
        }
    }
}
