package com.connecthub.gameservice.clock;

import com.connecthub.gameservice.clock.scheduler.CountdownScheduler;
import com.connecthub.gameservice.clock.scheduler.CountdownSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 把事件循环线程和时钟拼装成通用倒计时调度器，不涉及任何对局逻辑。
 */
@Configuration
public class ClockAutoConfig {

    /** 统一时钟，测试中可替换 */
    @Bean
    public Clock sessionClock() {
        return Clock.systemUTC();
    }

    /**
     * 注册倒计时调度器：回调全部在会话事件循环线程上执行。
     */
    @Bean
    public CountdownScheduler countdownScheduler(@Qualifier("sessionLoopExecutor") ScheduledThreadPoolExecutor loop,
                                                 Clock sessionClock) {
        return new CountdownSchedulerImpl(loop, sessionClock);
    }
}
