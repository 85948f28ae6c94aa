package com.connecthub.gameservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：AI 搜索时每个分支都在副本上模拟，绝不改动调用方的状态。
 * - 具体游戏（如 Connect Four 的 Board）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝。
     */
    GameState copy();
}
