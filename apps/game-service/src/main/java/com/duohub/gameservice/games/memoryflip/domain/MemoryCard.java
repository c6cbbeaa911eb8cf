package com.duohub.gameservice.games.memoryflip.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一张牌。pairId 相同的两张牌构成一对。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemoryCard {

    public enum Status { HIDDEN, MATCHED }

    private String id;
    private int position;
    private String emoji;
    private String pairId;
    private Status status = Status.HIDDEN;
    private String matchedBy;
    private Long matchedAt;

    public MemoryCard copy() {
        return new MemoryCard(id, position, emoji, pairId, status, matchedBy, matchedAt);
    }
}
