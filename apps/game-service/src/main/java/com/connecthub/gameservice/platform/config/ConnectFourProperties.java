package com.connecthub.gameservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 四子棋对局参数（application.yml 中 connect4.*）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "connect4")
public class ConnectFourProperties {

    private Matchmaking matchmaking = new Matchmaking();
    private Reconnect reconnect = new Reconnect();
    private Ai ai = new Ai();
    private Session session = new Session();

    @Data
    public static class Matchmaking {
        /** 排队多久无人匹配则改为与 AI 对战 */
        private long timeoutSeconds = 10;
    }

    @Data
    public static class Reconnect {
        /** 掉线后保留座位的宽限期，超时判负 */
        private long graceSeconds = 30;
    }

    @Data
    public static class Ai {
        /** 搜索深度，实际会被限定在 3~7 */
        private int searchDepth = 5;
        /** AI 落子前的展示延迟（毫秒），不影响正确性 */
        private long thinkDelayMs = 600;
    }

    @Data
    public static class Session {
        /** 已结束对局在内存中保留多久，之后重复提交得到 NOT_FOUND */
        private long retentionMinutes = 10;
    }
}
