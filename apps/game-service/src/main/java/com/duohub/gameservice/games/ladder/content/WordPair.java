package com.duohub.gameservice.games.ladder.content;

/**
 * 一道单词阶梯题目。
 */
public record WordPair(String id, String startWord, String endWord, String language, Integer optimalSteps) {
}
