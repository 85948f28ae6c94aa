package com.connecthub.gameservice.games.connectfour.domain.enums;

/** 对局结束原因 */
public enum EndReason {
    WIN,
    DRAW,
    ABANDONED;

    /** 对外展示用的小写形式 */
    public String label() {
        return name().toLowerCase();
    }
}
