package com.connecthub.gamekafkanotifier.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对局生命周期事件。
 * <p>
 * 对局开始、落子、结束、掉线、重连时产生，以 sessionId 作为 Kafka 消息 key，
 * 保证同一局的事件落在同一分区、按发生顺序消费。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameLifecycleEvent {

    /** 对局 ID */
    private String sessionId;

    /** 事件类型 */
    private EventType eventType;

    /** 触发事件的参与者 ID（对局级事件可为空） */
    private String participantId;

    /** 事件时间戳（毫秒） */
    private Long timestamp;

    /** 附加数据，如列号、结束原因、胜者 */
    private Map<String, Object> data;

    public enum EventType {
        /** 对局开始 */
        GAME_START,
        /** 落子 */
        MOVE_MADE,
        /** 对局结束（胜/和/弃局） */
        GAME_END,
        /** 玩家掉线 */
        PLAYER_DISCONNECT,
        /** 玩家重连 */
        PLAYER_RECONNECT
    }

    /**
     * 创建事件实例（自动设置时间戳）
     */
    public static GameLifecycleEvent of(String sessionId, EventType eventType, String participantId,
                                        Map<String, Object> data) {
        Map<String, Object> copy = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        return new GameLifecycleEvent(sessionId, eventType, participantId, Instant.now().toEpochMilli(), copy);
    }

    public static GameLifecycleEvent of(String sessionId, EventType eventType, String participantId) {
        return of(sessionId, eventType, participantId, null);
    }
}
