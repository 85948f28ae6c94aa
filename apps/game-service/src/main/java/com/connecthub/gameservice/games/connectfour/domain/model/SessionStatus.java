package com.connecthub.gameservice.games.connectfour.domain.model;

/**
 * 对局状态，只能单向推进：WAITING → IN_PROGRESS → COMPLETED / ABANDONED。
 */
public enum SessionStatus {
    /** 仍在匹配队列中（对局对象创建时已跳过该状态） */
    WAITING,
    /** 对局进行中 */
    IN_PROGRESS,
    /** 分出胜负或和棋 */
    COMPLETED,
    /** 一方掉线超时，判另一方胜 */
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}
