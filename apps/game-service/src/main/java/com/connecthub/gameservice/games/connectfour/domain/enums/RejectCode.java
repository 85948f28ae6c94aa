package com.connecthub.gameservice.games.connectfour.domain.enums;

/**
 * 意图被拒绝的原因码，随 MOVE_REJECTED 推送给调用方。
 */
public enum RejectCode {
    /** 对局不存在 */
    NOT_FOUND,
    /** 列越界或该列已满 */
    ILLEGAL_MOVE,
    /** 不是该连接所属参与者的回合 */
    OUT_OF_TURN,
    /** 对局已结束（完成或弃局） */
    SESSION_NOT_ACTIVE,
    /** 已在进行中的对局里，应走重连而不是重新排队 */
    ALREADY_IN_SESSION,
    /** 参数缺失 */
    BAD_REQUEST,
    /** 玩家目录暂时不可用或排队积压，稍后重试 */
    UNAVAILABLE
}
