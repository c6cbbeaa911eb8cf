package com.duohub.gameservice.games.session.domain.model;

import java.util.Locale;

/**
 * 小游戏种类：决定走子校验器、完成判定与奖励档位表。
 */
public enum GameKind {
    /** 单词阶梯：严格轮流，每对情侣最多同时 3 局 */
    LADDER("ladder", 3, false),
    /** 默契问答：每天一局，各自作答一次 */
    QUIZ("quiz", 1, true),
    /** 记忆翻牌：每天一局，不限回合，谁都可以翻 */
    MEMORY_FLIP("memory-flip", 1, true);

    private final String wireName;
    private final int maxActivePerPair;
    private final boolean singletonPerDay;

    GameKind(String wireName, int maxActivePerPair, boolean singletonPerDay) {
        this.wireName = wireName;
        this.maxActivePerPair = maxActivePerPair;
        this.singletonPerDay = singletonPerDay;
    }

    /** 线上名（路径、通知、后端接口使用） */
    public String wireName() {
        return wireName;
    }

    public int maxActivePerPair() {
        return maxActivePerPair;
    }

    public boolean singletonPerDay() {
        return singletonPerDay;
    }

    /**
     * 解析线上名或枚举名（大小写不敏感）
     */
    public static GameKind fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("UNKNOWN_KIND: " + raw);
        }
        String s = raw.trim();
        for (GameKind k : values()) {
            if (k.wireName.equalsIgnoreCase(s) || k.name().equalsIgnoreCase(s.replace('-', '_'))) {
                return k;
            }
        }
        throw new IllegalArgumentException("UNKNOWN_KIND: " + raw.toLowerCase(Locale.ROOT));
    }
}
