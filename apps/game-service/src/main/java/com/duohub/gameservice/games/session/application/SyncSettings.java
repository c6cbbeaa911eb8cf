package com.duohub.gameservice.games.session.application;

import java.time.Duration;

/**
 * 同步参数。
 *
 * @param waiterFirstDelay  等待方第一次复查前的等待
 * @param waiterRetryDelay  等待方第二次复查前的等待
 * @param pollInterval      轮询间隔
 * @param conditionalCreate 建局前先在远端抢占槽位
 * @param slotClaimTtl      槽位占用的有效期
 */
public record SyncSettings(Duration waiterFirstDelay,
                           Duration waiterRetryDelay,
                           Duration pollInterval,
                           boolean conditionalCreate,
                           Duration slotClaimTtl) {

    public static SyncSettings defaults() {
        return new SyncSettings(Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(30),
                false, Duration.ofDays(2));
    }
}
