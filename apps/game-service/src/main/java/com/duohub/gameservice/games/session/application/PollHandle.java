package com.duohub.gameservice.games.session.application;

import com.duohub.gameservice.games.session.domain.repository.RemoteSessionStore;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 轮询句柄：取消后不再发起新的轮询，已经在途的推送不会被中断。
 */
public final class PollHandle {

    private final ScheduledFuture<?> ticker;
    private final RemoteSessionStore.Subscription subscription;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    PollHandle(ScheduledFuture<?> ticker, RemoteSessionStore.Subscription subscription) {
        this.ticker = ticker;
        this.subscription = subscription;
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        ticker.cancel(false);
        if (subscription != null) {
            subscription.close();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
