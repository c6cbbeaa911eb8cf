package com.duohub.gameservice.games.session.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GameSession
 * -------------------------------------------------------
 * 一局双人小游戏的共享状态（两台设备上 id 必须一致）。
 * - state 为按 kind 区分的强类型载荷；
 * - version 每次变更 +1，远端按它做条件写入；
 * - rewardsIssued 为奖励记账（tierKey -> 数额），只增不减，合并时取并集。
 * -------------------------------------------------------
 */
@Data
@NoArgsConstructor
public class GameSession {
    /** 会话ID（UUID），由创建方设备生成 */
    private String id;
    /** 情侣键 */
    private String pairKey;
    /** 两个参与者（已排序） */
    private List<String> participants = new ArrayList<>();
    /** 游戏种类 */
    private GameKind kind;
    /** 仲裁槽位：单例游戏为日期，单词阶梯为 initial-N / after-{完成的会话ID} */
    private String slotKey;
    /** 游戏载荷 */
    private SessionState state;
    /** 当前回合归属；终态或不限回合的游戏为 null */
    private String currentTurnOwner;
    private SessionStatus status;
    private long createdAt;
    private Long completedAt;
    private long expiresAt;
    /** 生成该会话的参与者 */
    private String createdBy;
    /** 版本号 */
    private long version;
    /** created / move / yielded / completed / expired */
    private String lastAction;
    private String lastActor;
    /** 已接受走子的指纹 */
    private Set<String> appliedMoves = new LinkedHashSet<>();
    /** 已发放奖励 */
    private Map<String, Integer> rewardsIssued = new LinkedHashMap<>();

    public boolean hasParticipant(String userId) {
        return userId != null && participants.contains(userId);
    }

    /**
     * 返回另一位参与者
     */
    public String partnerOf(String userId) {
        if (!hasParticipant(userId)) {
            throw new IllegalArgumentException("NOT_A_PARTICIPANT: " + userId);
        }
        return participants.get(0).equals(userId) ? participants.get(1) : participants.get(0);
    }

    /**
     * 奖励记账取并集；已有的 tierKey 保持原值
     */
    public boolean mergeRewards(Map<String, Integer> other) {
        boolean changed = false;
        if (other == null) return false;
        for (Map.Entry<String, Integer> e : other.entrySet()) {
            if (!rewardsIssued.containsKey(e.getKey())) {
                rewardsIssued.put(e.getKey(), e.getValue());
                changed = true;
            }
        }
        return changed;
    }

    public GameSession copy() {
        GameSession c = new GameSession();
        c.id = id;
        c.pairKey = pairKey;
        c.participants = new ArrayList<>(participants);
        c.kind = kind;
        c.slotKey = slotKey;
        c.state = state == null ? null : state.copy();
        c.currentTurnOwner = currentTurnOwner;
        c.status = status;
        c.createdAt = createdAt;
        c.completedAt = completedAt;
        c.expiresAt = expiresAt;
        c.createdBy = createdBy;
        c.version = version;
        c.lastAction = lastAction;
        c.lastActor = lastActor;
        c.appliedMoves = new LinkedHashSet<>(appliedMoves);
        c.rewardsIssued = new LinkedHashMap<>(rewardsIssued);
        return c;
    }
}
