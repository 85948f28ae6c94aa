package com.connecthub.gameservice.games.connectfour.infrastructure.redis;

/**
 * 四子棋 Redis Key 统一管理，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "connect4:";

    private RedisKeys() {}

    // ---- 对局归档（只写一次） ----
    public static String archivedSession(String sessionId) {
        return PFX + "archive:session:" + sessionId;
    }

    // ---- 玩家档案：hash{handle, gamesWon, gamesLost} ----
    public static String player(String participantId) {
        return PFX + "player:" + participantId;
    }

    // ---- 昵称 → 玩家 ID ----
    public static String handleIndex() {
        return PFX + "players:handles";
    }

    // ---- 排行榜 ZSET（分数 = 胜场 + 胜率/1000） ----
    public static String leaderboard() {
        return PFX + "leaderboard";
    }
}
