package com.connecthub.gameservice.platform.loop;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 会话事件循环。
 * <p>
 * STOMP 指令、断线事件、REST 查询都要先切到这里再访问对局状态；
 * 倒计时回调本身就调度在同一线程上。
 */
@Slf4j
@Component
public class SessionEventLoop {

    static final long CALL_TIMEOUT_MS = 5000;

    private final ScheduledExecutorService loop;
    private volatile Thread loopThread;

    public SessionEventLoop(@Qualifier("sessionLoopExecutor") ScheduledExecutorService loop) {
        this.loop = loop;
        loop.execute(() -> loopThread = Thread.currentThread());
    }

    /**
     * 投递一个意图，异步执行；异常只记录日志。
     */
    public void execute(String label, Runnable task) {
        loop.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("事件循环任务异常: task={}", label, e);
            }
        });
    }

    /**
     * 在事件循环上执行并等待结果（供 REST 读取使用）。
     * 已在循环线程上时直接执行。
     */
    public <T> T call(Callable<T> task) {
        if (Thread.currentThread() == loopThread) {
            return invoke(task);
        }
        Future<T> f = loop.submit(task);
        try {
            return f.get(CALL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for session loop", e);
        } catch (TimeoutException e) {
            f.cancel(false);
            throw new IllegalStateException("session loop busy", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException(e.getCause());
        }
    }

    private static <T> T invoke(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
