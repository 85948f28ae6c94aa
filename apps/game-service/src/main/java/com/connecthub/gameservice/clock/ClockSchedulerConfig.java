package com.connecthub.gameservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会话事件循环线程配置。
 *
 * 说明：
 * 1. 只有一个线程：所有对局状态的读写、所有倒计时回调都串行跑在它上面，内存表无需加锁；
 * 2. 线程命名为 session-loop-N（前缀可由 scheduler.loop.name-prefix 配置）；
 * 3. 守护线程，JVM 退出时不等待；
 * 4. 关闭后再提交的任务直接丢弃（DiscardPolicy）。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.loop.name-prefix:session-loop-}")
    private String namePrefix;

    @Bean(name = "sessionLoopExecutor", destroyMethod = "shutdown")
    public ScheduledThreadPoolExecutor sessionLoopExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, namePrefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(1, tf, new ThreadPoolExecutor.DiscardPolicy());
        // 关闭时丢弃尚未到期的倒计时
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }
}
