package com.connecthub.gameservice.games.connectfour.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 已结束对局的归档记录（写入存储，之后不再修改）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinalizedSession {
    private String sessionId;
    private String firstId;
    private String firstHandle;
    private boolean firstAi;
    private String secondId;
    private String secondHandle;
    private boolean secondAi;
    private String status;
    private String endReason;
    private String winnerId;
    private boolean draw;
    private String[][] board;
    private List<MoveRecord> moves = new ArrayList<>();
    private long createdAt;
    private long endedAt;

    /** 归档用的单步记录 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MoveRecord {
        private int seq;
        private String participantId;
        private int column;
        private int row;
        private long timestamp;
    }

    public static FinalizedSession of(Session s, String endReason) {
        List<MoveRecord> moves = new ArrayList<>(s.getMoves().size());
        for (Move m : s.getMoves()) {
            moves.add(new MoveRecord(m.seq(), m.participantId(), m.column(), m.row(), m.timestamp()));
        }
        Participant a = s.getFirst();
        Participant b = s.getSecond();
        return new FinalizedSession(s.getId(),
                a.getId(), a.getHandle(), a.isAi(),
                b.getId(), b.getHandle(), b.isAi(),
                s.getStatus().name(), endReason,
                s.getOutcome().winnerId(), s.getOutcome().draw(),
                s.getBoard().view(), moves,
                s.getCreatedAt(), s.getEndedAt() == null ? 0L : s.getEndedAt());
    }

    public long durationMs() {
        return Math.max(0L, endedAt - createdAt);
    }
}
