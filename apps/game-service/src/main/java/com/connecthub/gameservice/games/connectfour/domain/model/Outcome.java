package com.connecthub.gameservice.games.connectfour.domain.model;

/** 对局结果：未结束 / 某方胜 / 和棋 */
public record Outcome(String winnerId, boolean draw) {

    public static final Outcome NONE = new Outcome(null, false);

    public static Outcome winner(String participantId) {
        return new Outcome(participantId, false);
    }

    public static Outcome ofDraw() {
        return new Outcome(null, true);
    }

    public boolean isDecided() {
        return draw || winnerId != null;
    }
}
