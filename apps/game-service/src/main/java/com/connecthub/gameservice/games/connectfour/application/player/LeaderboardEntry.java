package com.connecthub.gameservice.games.connectfour.application.player;

/** 排行榜条目 */
public record LeaderboardEntry(String participantId, String handle, int gamesWon, int gamesLost,
                               int totalGames, double winRatio) {

    public static LeaderboardEntry of(PlayerProfile p) {
        return new LeaderboardEntry(p.id(), p.handle(), p.gamesWon(), p.gamesLost(), p.totalGames(), p.winRatio());
    }
}
