package com.connecthub.gameservice.games.connectfour.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局参与者（人类或 AI）。
 * connectionHandle 为当前 STOMP 会话 ID，掉线或 AI 时为 null；对外快照中永不暴露。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Participant {
    public static final String AI_HANDLE = "AI Bot";
    public static final String AI_ID_PREFIX = "bot_";

    private String id;
    private String handle;
    private String connectionHandle;
    private boolean ai;
    private boolean connected;
    private int gamesWon;
    private int gamesLost;
    private long lastSeen;
    /** 每次掉线自增，弃局倒计时携带该版本，重连后再掉线时旧倒计时自动作废 */
    private int disconnectVersion;

    public static Participant human(String id, String handle, String connectionHandle, long now) {
        return new Participant(id, handle, connectionHandle, false, true, 0, 0, now, 0);
    }

    /** 为对局合成 AI 对手，ID 形如 bot_{sessionId} */
    public static Participant ai(String sessionId, long now) {
        return new Participant(AI_ID_PREFIX + sessionId, AI_HANDLE, null, true, true, 0, 0, now, 0);
    }

    public Participant copy() {
        return new Participant(id, handle, connectionHandle, ai, connected, gamesWon, gamesLost, lastSeen,
                disconnectVersion);
    }
}
