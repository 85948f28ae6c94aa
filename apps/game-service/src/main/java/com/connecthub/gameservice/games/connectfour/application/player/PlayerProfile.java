package com.connecthub.gameservice.games.connectfour.application.player;

/**
 * 玩家档案：稳定 ID + 昵称 + 胜负计数。
 */
public record PlayerProfile(String id, String handle, int gamesWon, int gamesLost) {

    public int totalGames() {
        return gamesWon + gamesLost;
    }

    /** 胜率百分比，保留两位小数；无对局时为 0 */
    public double winRatio() {
        if (totalGames() == 0) return 0.0;
        return Math.round(gamesWon * 10000.0 / totalGames()) / 100.0;
    }
}
