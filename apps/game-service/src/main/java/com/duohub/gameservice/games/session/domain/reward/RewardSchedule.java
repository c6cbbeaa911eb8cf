package com.duohub.gameservice.games.session.domain.reward;

/**
 * 某种游戏的奖励配置。数额为 0 表示不发放该项。
 *
 * @param perMove        每步合法走子的积分
 * @param invalidPenalty 非法走子的扣分（负数）
 * @param completion     完成奖励
 * @param tiers          按质量指标的档位奖励
 */
public record RewardSchedule(int perMove, String moveReason,
                             int invalidPenalty, String penaltyReason,
                             int completion, String completionReason,
                             TierTable tiers) {

    public RewardSchedule {
        if (invalidPenalty > 0) {
            throw new IllegalArgumentException("invalidPenalty must not be positive");
        }
        if (tiers == null) {
            tiers = TierTable.EMPTY;
        }
    }
}
