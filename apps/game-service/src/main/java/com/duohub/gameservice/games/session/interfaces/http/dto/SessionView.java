package com.duohub.gameservice.games.session.interfaces.http.dto;

import com.duohub.gameservice.games.session.domain.model.GameSession;
import com.duohub.gameservice.games.session.domain.model.SessionState;

import java.util.List;
import java.util.Map;

/**
 * 会话对外视图（REST 与 STOMP 共用）。
 *
 * @param yourTurn 针对请求者：当前回合归属于自己，或不限回合且会话可玩
 */
public record SessionView(String id,
                          String pairKey,
                          String kind,
                          String slotKey,
                          String status,
                          List<String> participants,
                          String currentTurnOwner,
                          boolean yourTurn,
                          SessionState state,
                          long createdAt,
                          Long completedAt,
                          long expiresAt,
                          long version,
                          String lastAction,
                          String lastActor,
                          Map<String, Integer> rewardsIssued,
                          int rewardTotal) {

    public static SessionView of(GameSession s, String viewer) {
        boolean playable = s.getStatus().playable();
        boolean yourTurn = playable && viewer != null
                && (s.getCurrentTurnOwner() == null ? s.hasParticipant(viewer) : s.getCurrentTurnOwner().equals(viewer));
        int total = s.getRewardsIssued().values().stream().mapToInt(Integer::intValue).sum();
        return new SessionView(s.getId(), s.getPairKey(), s.getKind().wireName(), s.getSlotKey(),
                s.getStatus().name(), List.copyOf(s.getParticipants()), s.getCurrentTurnOwner(), yourTurn,
                s.getState(), s.getCreatedAt(), s.getCompletedAt(), s.getExpiresAt(), s.getVersion(),
                s.getLastAction(), s.getLastActor(), Map.copyOf(s.getRewardsIssued()), total);
    }
}
