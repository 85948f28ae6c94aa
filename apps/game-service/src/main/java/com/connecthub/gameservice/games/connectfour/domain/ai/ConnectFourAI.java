package com.connecthub.gameservice.games.connectfour.domain.ai;

import com.connecthub.gameservice.engine.core.AiAdvisor;
import com.connecthub.gameservice.games.connectfour.domain.model.Board;
import com.connecthub.gameservice.games.connectfour.domain.rule.ConnectFourJudge;

import java.util.List;
import java.util.Optional;

/**
 * ConnectFourAI：
 * 1) 我方一步即胜，直接下；
 * 2) 对方一步即胜，立刻堵；
 * 3) 否则 minimax + α-β 剪枝搜索到 searchDepth 层（限定在 3~7）。
 * 每个分支都在棋盘副本上模拟，调用方传入的棋盘不会被修改。
 */
public class ConnectFourAI implements AiAdvisor<Board, BotMove> {

    public static final int MIN_DEPTH = 3;
    public static final int MAX_DEPTH = 7;
    public static final int DEFAULT_DEPTH = 5;

    /** 搜索无结果时的兜底顺序：中间优先 */
    static final int[] CENTER_ORDER = {3, 2, 4, 1, 5, 0, 6};

    private final int searchDepth;

    public ConnectFourAI(int searchDepth) {
        this.searchDepth = Math.max(MIN_DEPTH, Math.min(MAX_DEPTH, searchDepth));
    }

    public int getSearchDepth() {
        return searchDepth;
    }

    /** 选出 selfId 的落子列；无合法列时返回 -1 */
    public int chooseMove(Board board, String selfId, String opponentId) {
        return suggest(board, selfId, opponentId).column();
    }

    @Override
    public BotMove suggest(Board board, String selfId, String opponentId) {
        List<Integer> legal = ConnectFourJudge.legalColumns(board);
        if (legal.isEmpty()) {
            return new BotMove(selfId, -1, 0, "no legal column");
        }

        int win = findImmediateWin(board, legal, selfId);
        if (win >= 0) return new BotMove(selfId, win, Evaluator.WIN_SCORE, "taking winning move");

        int block = findImmediateWin(board, legal, opponentId);
        if (block >= 0) return new BotMove(selfId, block, Evaluator.WIN_SCORE / 2, "blocking opponent win");

        int bestCol = -1;
        int bestScore = Integer.MIN_VALUE;
        int alpha = Integer.MIN_VALUE;
        for (int col : legal) {
            Board branch = board.copy();
            ConnectFourJudge.applyMove(branch, col, selfId);
            int score = minimax(branch, searchDepth - 1, false, alpha, Integer.MAX_VALUE, selfId, opponentId);
            // 严格大于：同分保留先遇到的列
            if (score > bestScore) {
                bestScore = score;
                bestCol = col;
            }
            alpha = Math.max(alpha, score);
        }

        if (bestCol < 0) {
            for (int col : CENTER_ORDER) {
                if (legal.contains(col)) {
                    return new BotMove(selfId, col, 0, "center column preference");
                }
            }
        }
        return new BotMove(selfId, bestCol, bestScore, describe(bestScore));
    }

    private int findImmediateWin(Board board, List<Integer> legal, String who) {
        for (int col : legal) {
            Board branch = board.copy();
            ConnectFourJudge.applyMove(branch, col, who);
            Optional<String> winner = ConnectFourJudge.detectWinner(branch);
            if (winner.isPresent() && winner.get().equals(who)) return col;
        }
        return -1;
    }

    private int minimax(Board board, int depth, boolean maximizing, int alpha, int beta,
                        String selfId, String opponentId) {
        Optional<String> winner = ConnectFourJudge.detectWinner(board);
        if (winner.isPresent() && winner.get().equals(selfId)) return Evaluator.WIN_SCORE + depth;
        if (winner.isPresent() && winner.get().equals(opponentId)) return -Evaluator.WIN_SCORE - depth;
        if (depth == 0 || ConnectFourJudge.isFull(board)) {
            return Evaluator.evaluate(board, selfId, opponentId);
        }

        String mover = maximizing ? selfId : opponentId;
        int best = maximizing ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        for (int col : ConnectFourJudge.legalColumns(board)) {
            Board branch = board.copy();
            ConnectFourJudge.applyMove(branch, col, mover);
            int score = minimax(branch, depth - 1, !maximizing, alpha, beta, selfId, opponentId);
            if (maximizing) {
                best = Math.max(best, score);
                alpha = Math.max(alpha, score);
            } else {
                best = Math.min(best, score);
                beta = Math.min(beta, score);
            }
            if (beta <= alpha) break;
        }
        return best;
    }

    private static String describe(int score) {
        if (score >= 500) return "strong offensive position";
        if (score >= 100) return "good strategic position";
        if (score >= 0) return "defensive positioning";
        return "best available option";
    }
}
