package com.duohub.gameservice.games.session.domain.reward;

import com.duohub.gameservice.games.session.domain.model.GameKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * 按 kind 注册的奖励表；状态机只读这里，不写死任何数额。
 */
public class RewardScheduleRegistry {

    private final Map<GameKind, RewardSchedule> schedules = new EnumMap<>(GameKind.class);

    public RewardScheduleRegistry register(GameKind kind, RewardSchedule schedule) {
        schedules.put(kind, schedule);
        return this;
    }

    public RewardSchedule require(GameKind kind) {
        RewardSchedule s = schedules.get(kind);
        if (s == null) {
            throw new IllegalArgumentException("NO_REWARD_SCHEDULE: " + kind);
        }
        return s;
    }

    /**
     * 默认奖励表
     */
    public static RewardScheduleRegistry defaults() {
        return new RewardScheduleRegistry()
                .register(GameKind.LADDER, new RewardSchedule(
                        10, "单词阶梯合法一步",
                        -2, "单词阶梯非法单词",
                        30, "完成单词阶梯",
                        // 指标 = 实际步数 - 最优步数
                        TierTable.of(RewardTier.of("optimal-bonus", Integer.MIN_VALUE, 0, 10, "最优路径奖励"))))
                .register(GameKind.QUIZ, new RewardSchedule(
                        0, null, 0, null, 0, null,
                        // 指标 = 默契度百分比
                        TierTable.of(
                                RewardTier.of("sync-100", 100, 100, 50, "默契度 100%").withBadge("PERFECT_SYNC"),
                                RewardTier.of("sync-80", 80, 99, 40, "默契度 80%+"),
                                RewardTier.of("sync-60", 60, 79, 30, "默契度 60%+"),
                                RewardTier.of("sync-base", Integer.MIN_VALUE, 59, 25, "完成默契问答"))))
                .register(GameKind.MEMORY_FLIP, new RewardSchedule(
                        10, "记忆翻牌配对成功",
                        0, null,
                        50, "完成记忆翻牌",
                        // 指标 = 耗费天数
                        TierTable.of(
                                RewardTier.of("same-day", Integer.MIN_VALUE, 0, 30, "当天完成"),
                                RewardTier.of("next-day", 1, 1, 20, "第二天完成"),
                                RewardTier.of("third-day", 2, 2, 10, "第三天完成"))));
    }
}
