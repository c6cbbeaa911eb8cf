package com.duohub.gameservice.games.session.domain.reward;

import java.util.List;
import java.util.Optional;

/**
 * 有序档位表：按声明顺序取第一个命中的档位，区间不允许重叠。
 */
public record TierTable(List<RewardTier> tiers) {

    public static final TierTable EMPTY = new TierTable(List.of());

    public TierTable {
        tiers = List.copyOf(tiers);
        for (int i = 0; i < tiers.size(); i++) {
            for (int j = i + 1; j < tiers.size(); j++) {
                RewardTier a = tiers.get(i);
                RewardTier b = tiers.get(j);
                if (a.min() <= b.max() && b.min() <= a.max()) {
                    throw new IllegalArgumentException("overlapping tiers: " + a.key() + " / " + b.key());
                }
            }
        }
    }

    public static TierTable of(RewardTier... tiers) {
        return new TierTable(List.of(tiers));
    }

    public Optional<RewardTier> match(int metric) {
        return tiers.stream().filter(t -> t.covers(metric)).findFirst();
    }
}
