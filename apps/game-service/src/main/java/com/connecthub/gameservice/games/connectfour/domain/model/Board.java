package com.connecthub.gameservice.games.connectfour.domain.model;

import com.connecthub.gameservice.engine.core.GameState;

/**
 * 四子棋棋盘：7 列 x 6 行，按列存储 cells[col][row]，row=0 为最底行。
 * 约定：null 表示空格，否则为落子参与者的 ID。
 * <p>
 * 重力不变式：每列已占用的格子从 row 0 起连续向上，不存在悬空棋子。
 */
public class Board implements GameState {
    /** 列数 */
    public static final int COLS = 7;
    /** 行数 */
    public static final int ROWS = 6;
    /** 连成多少子获胜 */
    public static final int CONNECT = 4;

    private final String[][] cells;

    private Board(String[][] cells) {
        this.cells = cells;
    }

    /** 新建空棋盘 */
    public static Board empty() {
        return new Board(new String[COLS][ROWS]);
    }

    /** 由列优先的二维数组恢复棋盘（会做拷贝） */
    public static Board of(String[][] columnMajor) {
        if (columnMajor == null || columnMajor.length != COLS) {
            throw new IllegalArgumentException("board must have " + COLS + " columns");
        }
        String[][] copy = new String[COLS][];
        for (int c = 0; c < COLS; c++) {
            if (columnMajor[c] == null || columnMajor[c].length != ROWS) {
                throw new IllegalArgumentException("column " + c + " must have " + ROWS + " rows");
            }
            copy[c] = columnMajor[c].clone();
        }
        return new Board(copy);
    }

    public static boolean inBounds(int col, int row) {
        return col >= 0 && col < COLS && row >= 0 && row < ROWS;
    }

    /** 读取格子，越界返回 null */
    public String get(int col, int row) {
        return inBounds(col, row) ? cells[col][row] : null;
    }

    public boolean isEmpty(int col, int row) {
        return inBounds(col, row) && cells[col][row] == null;
    }

    /** 直接写格子（不做重力/合法性校验，由规则层 ConnectFourJudge 负责） */
    public void place(int col, int row, String participantId) {
        cells[col][row] = participantId;
    }

    /** 已落子数 */
    public int filledCount() {
        int n = 0;
        for (String[] column : cells) {
            for (String cell : column) {
                if (cell != null) n++;
            }
        }
        return n;
    }

    /** 深拷贝棋盘（供 AI 搜索分支使用） */
    @Override
    public Board copy() {
        String[][] copy = new String[COLS][];
        for (int c = 0; c < COLS; c++) copy[c] = cells[c].clone();
        return new Board(copy);
    }

    /** 只读视图副本（序列化给前端/落库） */
    public String[][] view() {
        return copy().cells;
    }
}
