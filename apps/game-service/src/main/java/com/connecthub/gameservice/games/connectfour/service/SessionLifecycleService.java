package com.connecthub.gameservice.games.connectfour.service;

import com.connecthub.gameservice.games.connectfour.domain.model.SessionSnapshot;

import java.util.Optional;

/**
 * 对局生命周期：匹配、落子、掉线、重连、弃局。
 * <p>
 * 所有方法都必须在会话事件循环线程上调用；
 * 被拒绝的意图抛出 {@link com.connecthub.gameservice.games.connectfour.domain.exception.SessionRejectedException}，
 * 抛出前不修改任何状态。
 */
public interface SessionLifecycleService {

    /**
     * 加入匹配：立即配对，或入队并启动匹配超时。
     * 参数错误、连接已在对局中时同步抛出；玩家档案在存储线程解析，之后的拒绝以 MOVE_REJECTED 推送。
     */
    void joinQueue(String handle, String connectionHandle);

    /** 落子 */
    void submitMove(String sessionId, String connectionHandle, int column);

    /** 凭昵称重新接入进行中的对局 */
    void rejoin(String sessionId, String handle, String newConnectionHandle);

    /** 连接断开（排队中则出队，对局中则启动弃局倒计时） */
    void onConnectionLost(String connectionHandle);

    /** 匹配超时到期：仍在排队则与 AI 开局 */
    void onMatchmakingTimeout(String participantId, long ticket);

    /** 弃局倒计时到期：仍未重连则判负 */
    void onAbandonTimeout(String sessionId, String participantId, int disconnectVersion);

    /** AI 落子回调：仍是 AI 回合且棋局未变才落子 */
    void onAiTurn(String sessionId, int expectedMoveCount);

    /** 对局快照（进行中或刚结束） */
    Optional<SessionSnapshot> snapshot(String sessionId);
}
