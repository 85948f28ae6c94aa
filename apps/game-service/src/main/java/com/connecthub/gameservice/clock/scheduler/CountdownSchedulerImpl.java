package com.connecthub.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 基于单线程 ScheduledExecutorService 的一次性倒计时。
 *
 * 职责：
 *  - 按绝对截止时间调度回调；
 *  - 回调异常只记日志，不影响事件循环线程继续工作。
 *
 * 不做的事：
 *  - 不持久化，进程重启后倒计时随对局一起丢失；
 *  - 不取消，过期与否由回调方自己判断。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    // key#version -> 任务句柄（仅用于统计与诊断）
    private final ConcurrentMap<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(ScheduledExecutorService scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void start(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
        String token = key + "#" + version;
        long delayMs = Math.max(0L, deadlineEpochMs - clock.millis());
        ScheduledFuture<?> fut = scheduler.schedule(() -> {
            pending.remove(token);
            safeTimeout(onTimeout, key, owner, version);
        }, delayMs, TimeUnit.MILLISECONDS);
        // 任务可能在 put 之前就已执行完
        if (!fut.isDone()) {
            pending.put(token, fut);
        }
        log.debug("倒计时已启动: key={}, owner={}, version={}, delayMs={}", key, owner, version, delayMs);
    }

    @Override
    public int pendingCount() {
        pending.values().removeIf(ScheduledFuture::isDone);
        return pending.size();
    }

    private void safeTimeout(TimeoutHandler h, String key, String owner, String version) {
        try {
            h.onTimeout(key, owner, version);
        } catch (RuntimeException e) {
            log.error("倒计时回调异常: key={}, owner={}, version={}", key, owner, version, e);
        }
    }
}
