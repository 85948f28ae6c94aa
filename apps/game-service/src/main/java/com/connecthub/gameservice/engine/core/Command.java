package com.connecthub.gameservice.engine.core;

/**
 * 玩家/AI 的一条输入指令（如“在第 3 列落子”）。
 * 传输层只认 Command，具体内容由各游戏定义。
 */
public interface Command {

    /** 发出该指令的参与者 ID */
    String participantId();
}
