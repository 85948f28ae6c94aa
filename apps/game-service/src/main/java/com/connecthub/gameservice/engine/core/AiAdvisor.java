package com.connecthub.gameservice.engine.core;

/**
 * AI 建议器：给定状态与双方身份，返回一条建议的指令。
 * - 实现必须是纯函数：只读 state，不修改；
 * - 搜索深度/预算由实现自身的构造参数决定。
 */
public interface AiAdvisor<S extends GameState, C extends Command> {

    C suggest(S state, String selfId, String opponentId);
}
