package com.connecthub.gameservice.games.connectfour.domain.ai;

import com.connecthub.gameservice.games.connectfour.domain.model.Board;
import com.connecthub.gameservice.games.connectfour.domain.rule.ConnectFourJudge;

import java.util.Optional;

import static com.connecthub.gameservice.games.connectfour.domain.model.Board.CONNECT;

/**
 * 局面评估：
 * - forId 已胜 +1000，againstId 已胜 -1000，满盘和棋 0；
 * - 否则累加所有长度为 4 的窗口分值（横/竖/两条斜线），
 *   窗口内双方都有子记 0，只有一方时按 4/3/2/1 子记 1000/50/10/1（对手取负）。
 */
public final class Evaluator {

    public static final int WIN_SCORE = 1000;

    private Evaluator() {}

    public static int evaluate(Board board, String forId, String againstId) {
        Optional<String> winner = ConnectFourJudge.detectWinner(board);
        if (winner.isPresent()) {
            if (winner.get().equals(forId)) return WIN_SCORE;
            if (winner.get().equals(againstId)) return -WIN_SCORE;
        }
        if (ConnectFourJudge.isFull(board)) return 0;

        int score = 0;
        for (int[] s : ConnectFourJudge.SCANS) {
            for (int col = s[2]; col < s[3]; col++) {
                for (int row = s[4]; row < s[5]; row++) {
                    score += window(board, col, row, s[0], s[1], forId, againstId);
                }
            }
        }
        return score;
    }

    static int window(Board board, int col, int row, int dCol, int dRow, String forId, String againstId) {
        int mine = 0, theirs = 0;
        for (int i = 0; i < CONNECT; i++) {
            String cell = board.get(col + i * dCol, row + i * dRow);
            if (cell == null) continue;
            if (cell.equals(forId)) mine++;
            else if (cell.equals(againstId)) theirs++;
        }
        if (mine > 0 && theirs > 0) return 0;
        if (mine > 0) return weight(mine);
        if (theirs > 0) return -weight(theirs);
        return 0;
    }

    private static int weight(int count) {
        switch (count) {
            case 4: return WIN_SCORE;
            case 3: return 50;
            case 2: return 10;
            case 1: return 1;
            default: return 0;
        }
    }
}
