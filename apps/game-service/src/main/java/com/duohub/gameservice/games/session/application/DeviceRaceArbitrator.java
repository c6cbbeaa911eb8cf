package com.duohub.gameservice.games.session.application;

import com.duohub.gameservice.games.session.domain.model.GameSession;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 双设备建局竞争的仲裁：
 * 1) 两个参与者ID按字典序比较，排前者为创建方，另一方为等待方（纯计算，无网络）；
 * 2) 等待方先轮询远端、等待、再轮询，仍然没有才自己创建（见 {@link SessionSynchronizer}）；
 * 3) 同一槽位仍出现多局时，按确定性规则选出唯一胜者，两台设备各自计算结果一致。
 *
 * 残留竞争（双方都离线时各自创建）概率有界，由第 3 步收敛。
 */
public class DeviceRaceArbitrator {

    public enum Role { CREATOR, WAITER }

    public enum TieBreak {
        /** 会话ID最小者胜 */
        ID,
        /** 创建时间最早者胜，同时间再比ID */
        CREATED_AT
    }

    private final Comparator<GameSession> order;

    public DeviceRaceArbitrator(TieBreak tieBreak) {
        Comparator<GameSession> byId = Comparator.comparing(GameSession::getId);
        this.order = tieBreak == TieBreak.CREATED_AT
                ? Comparator.comparingLong(GameSession::getCreatedAt).thenComparing(byId)
                : byId;
    }

    public Role roleOf(String self, String partner) {
        if (self == null || partner == null) {
            throw new IllegalArgumentException("PARTICIPANT_REQUIRED");
        }
        int c = self.compareTo(partner);
        if (c == 0) {
            throw new IllegalArgumentException("PARTICIPANTS_MUST_DIFFER: " + self);
        }
        return c < 0 ? Role.CREATOR : Role.WAITER;
    }

    /**
     * 从同槽位的候选中选出权威会话
     */
    public GameSession pickAuthoritative(Collection<GameSession> candidates) {
        return candidates.stream().min(order)
                .orElseThrow(() -> new IllegalArgumentException("NO_CANDIDATES"));
    }

    /**
     * 除胜者外的其余候选
     */
    public List<GameSession> losers(Collection<GameSession> candidates) {
        GameSession winner = pickAuthoritative(candidates);
        return candidates.stream()
                .filter(s -> !s.getId().equals(winner.getId()))
                .collect(Collectors.toList());
    }
}
