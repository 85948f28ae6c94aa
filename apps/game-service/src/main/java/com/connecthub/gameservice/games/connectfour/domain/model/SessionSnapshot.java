package com.connecthub.gameservice.games.connectfour.domain.model;

/**
 * 对局只读快照（推送给前端 / REST 查询）。
 * 不含连接句柄与逐步棋谱，棋盘为列优先 cells[col][row]，null 表示空。
 */
public final class SessionSnapshot {

    public final String sessionId;
    public final ParticipantView first;
    public final ParticipantView second;
    public final String turn;
    public final String[][] board;
    public final String status;
    public final String winnerId;
    public final boolean draw;
    public final int moveCount;
    public final long createdAt;
    public final Long endedAt;

    public SessionSnapshot(String sessionId,
                           ParticipantView first,
                           ParticipantView second,
                           String turn,
                           String[][] board,
                           String status,
                           String winnerId,
                           boolean draw,
                           int moveCount,
                           long createdAt,
                           Long endedAt) {
        this.sessionId = sessionId;
        this.first = first;
        this.second = second;
        this.turn = turn;
        this.board = board;
        this.status = status;
        this.winnerId = winnerId;
        this.draw = draw;
        this.moveCount = moveCount;
        this.createdAt = createdAt;
        this.endedAt = endedAt;
    }

    public static SessionSnapshot of(Session s) {
        return new SessionSnapshot(
                s.getId(),
                ParticipantView.of(s.getFirst()),
                ParticipantView.of(s.getSecond()),
                s.isInProgress() ? s.getTurn() : null,
                s.getBoard().view(),
                s.getStatus().name(),
                s.getOutcome().winnerId(),
                s.getOutcome().draw(),
                s.getMoves().size(),
                s.getCreatedAt(),
                s.getEndedAt());
    }

    /** 参与者公开字段 */
    public record ParticipantView(String id, String handle, boolean ai, boolean connected) {
        public static ParticipantView of(Participant p) {
            return new ParticipantView(p.getId(), p.getHandle(), p.isAi(), p.isConnected());
        }
    }
}
