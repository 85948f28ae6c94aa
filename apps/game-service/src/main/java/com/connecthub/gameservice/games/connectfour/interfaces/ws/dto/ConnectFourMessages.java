package com.connecthub.gameservice.games.connectfour.interfaces.ws.dto;

import com.connecthub.gameservice.games.connectfour.domain.model.Move;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 四子棋 WebSocket 消息定义
 * ----------------------------------------
 *   1. 前端 -> 后端：/app/connect4.join、/app/connect4.move、/app/connect4.rejoin
 *   2. 后端 -> 前端：/user/queue/connect4.events 上的 {@link BroadcastEvent}
 */
public class ConnectFourMessages {

    /** 事件类型 */
    public static final String QUEUED = "QUEUED";
    public static final String SESSION_STARTED = "SESSION_STARTED";
    public static final String SESSION_REJOINED = "SESSION_REJOINED";
    public static final String MOVE_APPLIED = "MOVE_APPLIED";
    public static final String SESSION_ENDED = "SESSION_ENDED";
    public static final String OPPONENT_DISCONNECTED = "OPPONENT_DISCONNECTED";
    public static final String OPPONENT_RECONNECTED = "OPPONENT_RECONNECTED";
    public static final String MOVE_REJECTED = "MOVE_REJECTED";

    /** 加入匹配 */
    @Data
    public static class JoinCmd {
        private String handle;
    }

    /** 落子 */
    @Data
    public static class MoveCmd {
        private String sessionId;
        /** 缺省时为 null，按参数错误拒绝 */
        private Integer column;
    }

    /** 重连 */
    @Data
    public static class RejoinCmd {
        private String sessionId;
        private String handle;
    }

    /** 推送事件（服务端 → 客户端） */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String sessionId;
        private String type;
        private Object payload;
    }

    public record QueuedPayload(long timeoutSeconds) {}

    public record StartedPayload(SessionSnapshot snapshot, String yourId, String opponentId, boolean vsAi) {}

    public record RejoinedPayload(SessionSnapshot snapshot, String yourId, String opponentId) {}

    public record MoveAppliedPayload(SessionSnapshot snapshot, Move move, String nextTurn) {}

    public record EndedPayload(SessionSnapshot snapshot, String winnerId, boolean draw, String reason) {}

    public record PresencePayload(String participantId, Long timeoutSeconds) {}

    public record RejectedPayload(String code, String message) {}
}
