package com.connecthub.gameservice.games.connectfour.domain.rule;

import com.connecthub.gameservice.games.connectfour.domain.model.Board;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.connecthub.gameservice.games.connectfour.domain.model.Board.COLS;
import static com.connecthub.gameservice.games.connectfour.domain.model.Board.CONNECT;
import static com.connecthub.gameservice.games.connectfour.domain.model.Board.ROWS;

/**
 * 四子棋规则判定（纯函数，只依赖传入的棋盘）。
 */
public final class ConnectFourJudge {

    /**
     * 扫描方向及起点范围，顺序固定：横、竖、右上斜、右下斜。
     * 每项为 {dCol, dRow, colFrom, colTo, rowFrom, rowTo}（to 为开区间）。
     */
    public static final int[][] SCANS = {
            {1, 0, 0, COLS - CONNECT + 1, 0, ROWS},
            {0, 1, 0, COLS, 0, ROWS - CONNECT + 1},
            {1, 1, 0, COLS - CONNECT + 1, 0, ROWS - CONNECT + 1},
            {1, -1, 0, COLS - CONNECT + 1, CONNECT - 1, ROWS}
    };

    private ConnectFourJudge() {}

    public static Board createEmptyBoard() {
        return Board.empty();
    }

    /** 列在范围内且顶格为空 */
    public static boolean isLegal(Board board, int column) {
        return column >= 0 && column < COLS && board.get(column, ROWS - 1) == null;
    }

    /** 所有可落子的列（升序） */
    public static List<Integer> legalColumns(Board board) {
        List<Integer> cols = new ArrayList<>(COLS);
        for (int c = 0; c < COLS; c++) {
            if (isLegal(board, c)) cols.add(c);
        }
        return cols;
    }

    /**
     * 在该列最低的空位落子。
     * @return 落点行号；非法列返回 -1，棋盘不变
     */
    public static int applyMove(Board board, int column, String participantId) {
        if (!isLegal(board, column)) return -1;
        for (int row = 0; row < ROWS; row++) {
            if (board.isEmpty(column, row)) {
                board.place(column, row, participantId);
                return row;
            }
        }
        return -1;
    }

    /** 按固定顺序扫描全部长度为 4 的连线，返回第一条完整连线的归属 */
    public static Optional<String> detectWinner(Board board) {
        for (int[] s : SCANS) {
            for (int col = s[2]; col < s[3]; col++) {
                for (int row = s[4]; row < s[5]; row++) {
                    String owner = board.get(col, row);
                    if (owner != null && runOf(board, col, row, s[0], s[1], owner)) {
                        return Optional.of(owner);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /** 每列顶格均已占用 */
    public static boolean isFull(Board board) {
        for (int c = 0; c < COLS; c++) {
            if (board.get(c, ROWS - 1) == null) return false;
        }
        return true;
    }

    private static boolean runOf(Board board, int col, int row, int dCol, int dRow, String owner) {
        for (int i = 0; i < CONNECT; i++) {
            if (!owner.equals(board.get(col + i * dCol, row + i * dRow))) return false;
        }
        return true;
    }
}
