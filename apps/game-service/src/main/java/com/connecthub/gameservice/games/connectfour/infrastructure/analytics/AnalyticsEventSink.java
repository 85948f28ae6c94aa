package com.connecthub.gameservice.games.connectfour.infrastructure.analytics;

import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent;
import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent.EventType;
import com.connecthub.gamekafkanotifier.publisher.GameEventPublisher;
import com.connecthub.gameservice.games.connectfour.application.LifecycleEventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * 分析事件出口：
 * - 本地保留最近 {@value #MAX_EVENTS} 条事件，用于统计接口；
 * - 配置了 Kafka 时异步转发到 {@link GameEventPublisher}，失败只记日志。
 */
@Slf4j
@Component
public class AnalyticsEventSink implements LifecycleEventSink {

    static final int MAX_EVENTS = 5000;

    private final ObjectProvider<GameEventPublisher> publisherProvider;
    private final Executor executor;
    private final Clock clock;

    private final Deque<GameLifecycleEvent> events = new ArrayDeque<>();

    public AnalyticsEventSink(ObjectProvider<GameEventPublisher> publisherProvider,
                              @Qualifier("eventSinkExecutor") Executor executor,
                              Clock clock) {
        this.publisherProvider = publisherProvider;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public void publish(GameLifecycleEvent event) {
        synchronized (events) {
            events.addLast(event);
            while (events.size() > MAX_EVENTS) events.pollFirst();
        }
        log.debug("对局事件: sessionId={}, type={}, participantId={}",
                event.getSessionId(), event.getEventType(), event.getParticipantId());

        GameEventPublisher publisher = publisherProvider.getIfAvailable();
        if (publisher == null) return;
        try {
            executor.execute(() -> publisher.publish(event));
        } catch (RuntimeException e) {
            log.warn("对局事件外发失败: sessionId={}, type={}", event.getSessionId(), event.getEventType(), e);
        }
    }

    /** 缓冲区内的事件副本（按发生顺序） */
    public List<GameLifecycleEvent> recentEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public AnalyticsSummary summary() {
        List<GameLifecycleEvent> snapshot = recentEvents();
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);

        long started = 0, ended = 0, todayCount = 0;
        Map<String, long[]> spans = new HashMap<>();
        int[] perHour = new int[24];
        for (GameLifecycleEvent e : snapshot) {
            long ts = e.getTimestamp() == null ? 0L : e.getTimestamp();
            if (e.getEventType() == EventType.GAME_START) {
                started++;
                spans.computeIfAbsent(e.getSessionId(), k -> new long[2])[0] = ts;
            } else if (e.getEventType() == EventType.GAME_END) {
                ended++;
                spans.computeIfAbsent(e.getSessionId(), k -> new long[2])[1] = ts;
            }
            var at = Instant.ofEpochMilli(ts).atZone(zone);
            if (at.toLocalDate().equals(today)) todayCount++;
            perHour[at.getHour()]++;
        }

        long total = 0;
        int finished = 0;
        for (long[] span : spans.values()) {
            if (span[0] > 0 && span[1] > 0) {
                total += span[1] - span[0];
                finished++;
            }
        }
        double avgMinutes = finished == 0 ? 0.0 : (double) total / finished / 60_000.0;

        int busiest = 0;
        for (int h = 1; h < 24; h++) {
            if (perHour[h] > perHour[busiest]) busiest = h;
        }
        return new AnalyticsSummary(started, ended, avgMinutes, todayCount, busiest);
    }
}
