package com.duohub.gameservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会话同步相关线程池：
 * 1. sessionSyncExecutor：远端推送、权威后端推送、积分账本调用（网络 IO）；
 * 2. sessionPollScheduler：等待方的延迟复查与定时轮询。
 * 两者分开，避免慢网络拖住轮询节奏。
 */
@Configuration
public class SyncSchedulerConfig {

    @Value("${scheduler.sync.corePoolSize:4}")
    private int syncPoolSize;

    @Value("${scheduler.poll.corePoolSize:2}")
    private int pollPoolSize;

    @Bean(name = "sessionSyncExecutor")
    public ThreadPoolExecutor sessionSyncExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(syncPoolSize, syncPoolSize,
                60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), daemonThreads("session-sync-"));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean(name = "sessionPollScheduler")
    public ScheduledThreadPoolExecutor sessionPollScheduler() {
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(pollPoolSize, daemonThreads("session-poll-"), new ThreadPoolExecutor.DiscardPolicy());
        // 轮询取消后，从调度队列里移除
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
