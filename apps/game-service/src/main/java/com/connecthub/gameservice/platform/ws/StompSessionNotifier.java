package com.connecthub.gameservice.platform.ws;

import com.connecthub.gameservice.games.connectfour.application.SessionNotifier;
import com.connecthub.gameservice.games.connectfour.domain.enums.EndReason;
import com.connecthub.gameservice.games.connectfour.domain.enums.RejectCode;
import com.connecthub.gameservice.games.connectfour.domain.model.Move;
import com.connecthub.gameservice.games.connectfour.domain.model.Outcome;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionSnapshot;
import com.connecthub.gameservice.games.connectfour.interfaces.ws.dto.ConnectFourMessages.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import static com.connecthub.gameservice.games.connectfour.interfaces.ws.dto.ConnectFourMessages.*;

/**
 * 基于 STOMP 的对局通知：按 WebSocket 会话 ID 点对点推送到 /user/queue/connect4.events。
 * 连接未认证，以会话 ID 充当 user 目的地，推送失败只记日志。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompSessionNotifier implements SessionNotifier {

    static final String DESTINATION = "/queue/connect4.events";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void queued(String connectionHandle, long timeoutSeconds) {
        send(connectionHandle, null, QUEUED, new QueuedPayload(timeoutSeconds));
    }

    @Override
    public void sessionStarted(String connectionHandle, SessionSnapshot snapshot, String yourId, String opponentId,
                               boolean vsAi) {
        send(connectionHandle, snapshot.sessionId, SESSION_STARTED,
                new StartedPayload(snapshot, yourId, opponentId, vsAi));
    }

    @Override
    public void sessionRejoined(String connectionHandle, SessionSnapshot snapshot, String yourId, String opponentId) {
        send(connectionHandle, snapshot.sessionId, SESSION_REJOINED, new RejoinedPayload(snapshot, yourId, opponentId));
    }

    @Override
    public void moveApplied(String connectionHandle, SessionSnapshot snapshot, Move move, String nextTurn) {
        send(connectionHandle, snapshot.sessionId, MOVE_APPLIED, new MoveAppliedPayload(snapshot, move, nextTurn));
    }

    @Override
    public void sessionEnded(String connectionHandle, SessionSnapshot snapshot, Outcome outcome, EndReason reason) {
        send(connectionHandle, snapshot.sessionId, SESSION_ENDED,
                new EndedPayload(snapshot, outcome.winnerId(), outcome.draw(), reason.label()));
    }

    @Override
    public void opponentDisconnected(String connectionHandle, String sessionId, String participantId,
                                     long timeoutSeconds) {
        send(connectionHandle, sessionId, OPPONENT_DISCONNECTED, new PresencePayload(participantId, timeoutSeconds));
    }

    @Override
    public void opponentReconnected(String connectionHandle, String sessionId, String participantId) {
        send(connectionHandle, sessionId, OPPONENT_RECONNECTED, new PresencePayload(participantId, null));
    }

    @Override
    public void moveRejected(String connectionHandle, String sessionId, RejectCode code, String message) {
        send(connectionHandle, sessionId, MOVE_REJECTED, new RejectedPayload(code.name(), message));
    }

    private void send(String connectionHandle, String sessionId, String type, Object payload) {
        if (connectionHandle == null) return;
        try {
            SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
            headerAccessor.setSessionId(connectionHandle);
            headerAccessor.setLeaveMutable(true);
            messagingTemplate.convertAndSendToUser(connectionHandle, DESTINATION,
                    new BroadcastEvent(sessionId, type, payload), headerAccessor.getMessageHeaders());
        } catch (Exception e) {
            log.warn("推送对局通知失败: conn={}, sessionId={}, type={}", connectionHandle, sessionId, type, e);
        }
    }
}
