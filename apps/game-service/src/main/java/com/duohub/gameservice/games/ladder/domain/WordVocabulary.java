package com.duohub.gameservice.games.ladder.domain;

/**
 * 可接受词表（按语言）。
 */
public interface WordVocabulary {

    boolean contains(String language, String word);
}
