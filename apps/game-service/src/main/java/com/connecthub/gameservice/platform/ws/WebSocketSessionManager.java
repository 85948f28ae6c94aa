package com.connecthub.gameservice.platform.ws;

import com.connecthub.gameservice.games.connectfour.service.SessionLifecycleService;
import com.connecthub.gameservice.platform.loop.SessionEventLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;

/**
 * 监听 STOMP 连接/断开事件。
 * 断开包括正常关闭、强制关闭浏览器、网络中断（心跳超时），统一转成 connection-closed 意图投递到事件循环。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final SessionLifecycleService lifecycleService;
    private final SessionEventLoop eventLoop;

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        log.debug("WebSocket 连接建立: sessionId={}", accessor.getSessionId());
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        log.info("WebSocket 断开: sessionId={}, closeStatus={}", sessionId, event.getCloseStatus());
        eventLoop.execute("connection-closed", () -> lifecycleService.onConnectionLost(sessionId));
    }
}
