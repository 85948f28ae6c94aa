package com.connecthub.gameservice.games.connectfour.domain.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一局四子棋。所有修改都由生命周期服务经 SessionRegistry 完成。
 * <p>
 * 约束：IN_PROGRESS 时 turn 恰为两名参与者之一；status 只能单向推进；棋谱只追加。
 * 只暴露读取方法，状态变化一律经由 flipTurn / appendMove / finish。
 */
@Getter
public class Session {
    private final String id;
    /** 先手 */
    private final Participant first;
    /** 后手 */
    private final Participant second;
    private final Board board;
    private final List<Move> moves = new ArrayList<>();
    private final long createdAt;

    private String turn;
    private SessionStatus status;
    private Outcome outcome = Outcome.NONE;
    private Long endedAt;

    public Session(String id, Participant first, Participant second, long createdAt) {
        this.id = id;
        this.first = first;
        this.second = second;
        this.board = Board.empty();
        this.createdAt = createdAt;
        this.turn = first.getId();
        this.status = SessionStatus.IN_PROGRESS;
    }

    /** 棋谱只读视图 */
    public List<Move> getMoves() {
        return Collections.unmodifiableList(moves);
    }

    public boolean isInProgress() {
        return status == SessionStatus.IN_PROGRESS;
    }

    public boolean hasAi() {
        return first.isAi() || second.isAi();
    }

    public Participant participant(String participantId) {
        if (first.getId().equals(participantId)) return first;
        if (second.getId().equals(participantId)) return second;
        return null;
    }

    public Participant opponentOf(String participantId) {
        if (first.getId().equals(participantId)) return second;
        if (second.getId().equals(participantId)) return first;
        return null;
    }

    public Participant currentParticipant() {
        return participant(turn);
    }

    public Optional<Participant> byConnection(String connectionHandle) {
        if (connectionHandle == null) return Optional.empty();
        if (connectionHandle.equals(first.getConnectionHandle())) return Optional.of(first);
        if (connectionHandle.equals(second.getConnectionHandle())) return Optional.of(second);
        return Optional.empty();
    }

    /** 按显示名匹配人类参与者（重连时使用） */
    public Optional<Participant> humanByHandle(String handle) {
        if (handle == null) return Optional.empty();
        if (!first.isAi() && handle.equals(first.getHandle())) return Optional.of(first);
        if (!second.isAi() && handle.equals(second.getHandle())) return Optional.of(second);
        return Optional.empty();
    }

    public List<Participant> participants() {
        return List.of(first, second);
    }

    public void flipTurn() {
        turn = Objects.requireNonNull(opponentOf(turn)).getId();
    }

    /** 追加一步，返回该步记录 */
    public Move appendMove(String participantId, int column, int row, long now) {
        Move move = new Move(moves.size() + 1, participantId, column, row, now);
        moves.add(move);
        return move;
    }

    /** 进入终态（COMPLETED/ABANDONED），终态之后不可再改 */
    public void finish(SessionStatus terminal, Outcome result, long now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("session " + id + " already " + status);
        }
        this.status = terminal;
        this.outcome = result;
        this.endedAt = now;
    }
}
