package com.connecthub.gameservice.games.connectfour.domain.ai;

import com.connecthub.gameservice.engine.core.Command;

/**
 * AI 的选择结果：列号（无可落子时为 -1）、评分与一句话理由（仅用于日志）。
 */
public record BotMove(String participantId, int column, int score, String reasoning) implements Command {

    public boolean isPass() {
        return column < 0;
    }
}
