package com.connecthub.gameservice.platform.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * 四子棋 WebSocket + STOMP 配置
 * ----------------------------------------
 *   - /ws（原生 WebSocket，附带 SockJS 回退）：连接入口，连接不做认证，昵称即身份
 *   - /app/connect4.*：客户端指令
 *   - /user/queue/connect4.events：按 STOMP 会话 ID 点对点推送
 *
 * 断网由心跳超时发现，随后触发 SessionDisconnectEvent（见 {@link WebSocketSessionManager}）。
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${connect4.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    /** 心跳间隔（毫秒），客户端与服务端相同 */
    @Value("${connect4.ws.heartbeat-ms:5000}")
    private long heartbeatMs;

    /**
     * 心跳调度器，单独命名以免与 STOMP 自带的 messageBrokerTaskScheduler 冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigins);
        registry.addEndpoint("/ws").setAllowedOriginPatterns(allowedOrigins).withSockJS();
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/queue")
                .setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }
}
