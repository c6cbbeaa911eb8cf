package com.duohub.gameservice.games.session.domain.reward;

/**
 * 奖励档位：质量指标落在 [min, max] 闭区间时发放 amount，可附带徽章。
 */
public record RewardTier(String key, int min, int max, int amount, String reason, String badge) {

    public RewardTier {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("tier key required");
        }
        if (min > max) {
            throw new IllegalArgumentException("tier " + key + " has min > max");
        }
    }

    public static RewardTier of(String key, int min, int max, int amount, String reason) {
        return new RewardTier(key, min, max, amount, reason, null);
    }

    public RewardTier withBadge(String badge) {
        return new RewardTier(key, min, max, amount, reason, badge);
    }

    public boolean covers(int metric) {
        return metric >= min && metric <= max;
    }
}
