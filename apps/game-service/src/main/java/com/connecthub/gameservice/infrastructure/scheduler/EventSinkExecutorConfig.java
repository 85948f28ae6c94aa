package com.connecthub.gameservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会话事件循环之外的 I/O 线程池，Kafka / Redis 阻塞不会拖慢对局。
 * <ul>
 *   <li>eventSinkExecutor：分析事件外发，积压时直接丢弃最新事件；</li>
 *   <li>storageExecutor：玩家目录查询、战绩写入、对局归档，积压时拒绝（AbortPolicy），由调用方记日志或回绝请求。</li>
 * </ul>
 */
@Configuration
public class EventSinkExecutorConfig {

    @Bean(name = "eventSinkExecutor", destroyMethod = "shutdown")
    public ExecutorService eventSinkExecutor() {
        return singleThread("event-sink-", new ThreadPoolExecutor.DiscardPolicy());
    }

    @Bean(name = "storageExecutor", destroyMethod = "shutdown")
    public ExecutorService storageExecutor() {
        return singleThread("storage-io-", new ThreadPoolExecutor.AbortPolicy());
    }

    private static ExecutorService singleThread(String prefix, RejectedExecutionHandler onFull) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1000), tf, onFull);
    }
}
