package com.connecthub.gameservice.games.connectfour.domain.ai;

import com.connecthub.gameservice.games.connectfour.domain.model.Board;
import com.connecthub.gameservice.games.connectfour.domain.rule.ConnectFourJudge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluatorTest {

    private static final String AI = "bot_s1";
    private static final String HUMAN = "p_h";

    @Test
    @DisplayName("空棋盘评分为 0")
    void emptyBoardIsNeutral() {
        assertThat(Evaluator.evaluate(Board.empty(), AI, HUMAN)).isZero();
    }

    @Test
    @DisplayName("底行中间一子覆盖 7 个窗口，双方视角互为相反数")
    void singlePieceWindows() {
        Board board = Board.empty();
        ConnectFourJudge.applyMove(board, 3, AI);

        assertThat(Evaluator.evaluate(board, AI, HUMAN)).isEqualTo(7);
        assertThat(Evaluator.evaluate(board, HUMAN, AI)).isEqualTo(-7);
    }

    @Test
    @DisplayName("已分胜负时直接返回 ±1000")
    void decidedBoard() {
        Board board = Board.empty();
        for (int i = 0; i < 4; i++) ConnectFourJudge.applyMove(board, 0, HUMAN);

        assertThat(Evaluator.evaluate(board, AI, HUMAN)).isEqualTo(-Evaluator.WIN_SCORE);
        assertThat(Evaluator.evaluate(board, HUMAN, AI)).isEqualTo(Evaluator.WIN_SCORE);
    }

    @Test
    @DisplayName("双方混杂的窗口不计分")
    void mixedWindowScoresZero() {
        Board board = Board.empty();
        ConnectFourJudge.applyMove(board, 0, AI);
        ConnectFourJudge.applyMove(board, 1, HUMAN);

        assertThat(Evaluator.window(board, 0, 0, 1, 0, AI, HUMAN)).isZero();
        assertThat(Evaluator.window(board, 0, 0, 0, 1, AI, HUMAN)).isEqualTo(1);
    }
}
