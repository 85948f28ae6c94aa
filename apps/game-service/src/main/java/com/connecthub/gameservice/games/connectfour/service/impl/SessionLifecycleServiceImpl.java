package com.connecthub.gameservice.games.connectfour.service.impl;

import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent;
import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent.EventType;
import com.connecthub.gameservice.clock.scheduler.CountdownScheduler;
import com.connecthub.gameservice.engine.core.AiAdvisor;
import com.connecthub.gameservice.games.connectfour.application.LifecycleEventSink;
import com.connecthub.gameservice.games.connectfour.application.MatchmakingQueue;
import com.connecthub.gameservice.games.connectfour.application.MatchmakingQueue.JoinResult;
import com.connecthub.gameservice.games.connectfour.application.SessionNotifier;
import com.connecthub.gameservice.games.connectfour.application.SessionRegistry;
import com.connecthub.gameservice.games.connectfour.application.player.PlayerDirectoryService;
import com.connecthub.gameservice.games.connectfour.application.player.PlayerProfile;
import com.connecthub.gameservice.games.connectfour.domain.ai.BotMove;
import com.connecthub.gameservice.games.connectfour.domain.constants.GameMessages;
import com.connecthub.gameservice.games.connectfour.domain.enums.EndReason;
import com.connecthub.gameservice.games.connectfour.domain.enums.RejectCode;
import com.connecthub.gameservice.games.connectfour.domain.exception.SessionRejectedException;
import com.connecthub.gameservice.games.connectfour.domain.model.Board;
import com.connecthub.gameservice.games.connectfour.domain.model.FinalizedSession;
import com.connecthub.gameservice.games.connectfour.domain.model.Move;
import com.connecthub.gameservice.games.connectfour.domain.model.Outcome;
import com.connecthub.gameservice.games.connectfour.domain.model.Participant;
import com.connecthub.gameservice.games.connectfour.domain.model.QueueEntry;
import com.connecthub.gameservice.games.connectfour.domain.model.Session;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionSnapshot;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionStatus;
import com.connecthub.gameservice.games.connectfour.domain.repository.SessionArchive;
import com.connecthub.gameservice.games.connectfour.domain.rule.ConnectFourJudge;
import com.connecthub.gameservice.games.connectfour.service.SessionLifecycleService;
import com.connecthub.gameservice.platform.config.ConnectFourProperties;
import com.connecthub.gameservice.platform.loop.SessionEventLoop;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * 对局生命周期服务实现。
 * <p>
 * 状态机：WAITING（仅存在于匹配队列）→ IN_PROGRESS → COMPLETED / ABANDONED。
 * 所有延迟动作（匹配超时、弃局倒计时、AI 落子、过期清理）都不取消，到期时重新校验状态。
 * 存储、统计、分析、推送失败都只记日志，不影响对局本身。
 * <p>
 * 会访问 Redis 的调用（玩家目录、战绩、归档）都交给 storageExecutor，事件循环线程上不做阻塞 I/O；
 * 加入匹配时先在存储线程解析玩家档案，再投递回事件循环完成排队。
 */
@Slf4j
@Service
public class SessionLifecycleServiceImpl implements SessionLifecycleService {

    private final MatchmakingQueue queue;
    private final SessionRegistry registry;
    private final SessionNotifier notifier;
    private final SessionArchive archive;
    private final LifecycleEventSink eventSink;
    private final PlayerDirectoryService playerDirectory;
    private final CountdownScheduler countdown;
    private final ConnectFourProperties props;
    private final Clock clock;
    private final AiAdvisor<Board, BotMove> aiAdvisor;
    private final SessionEventLoop eventLoop;
    private final Executor storageExecutor;

    /** 正在解析玩家档案的加入请求：connectionHandle → 昵称（仅事件循环线程访问） */
    private final Map<String, String> pendingJoins = new HashMap<>();

    public SessionLifecycleServiceImpl(MatchmakingQueue queue,
                                       SessionRegistry registry,
                                       SessionNotifier notifier,
                                       SessionArchive archive,
                                       LifecycleEventSink eventSink,
                                       PlayerDirectoryService playerDirectory,
                                       CountdownScheduler countdown,
                                       ConnectFourProperties props,
                                       Clock clock,
                                       AiAdvisor<Board, BotMove> aiAdvisor,
                                       SessionEventLoop eventLoop,
                                       @Qualifier("storageExecutor") Executor storageExecutor) {
        this.queue = queue;
        this.registry = registry;
        this.notifier = notifier;
        this.archive = archive;
        this.eventSink = eventSink;
        this.playerDirectory = playerDirectory;
        this.countdown = countdown;
        this.props = props;
        this.clock = clock;
        this.aiAdvisor = aiAdvisor;
        this.eventLoop = eventLoop;
        this.storageExecutor = storageExecutor;
    }

    // ========== 匹配 ==========

    @Override
    public void joinQueue(String handle, String connectionHandle) {
        if (StringUtils.isBlank(handle)) {
            throw new SessionRejectedException(RejectCode.BAD_REQUEST, null, GameMessages.HANDLE_REQUIRED);
        }
        String name = handle.trim();
        requireConnectionFree(connectionHandle);

        pendingJoins.put(connectionHandle, name);
        try {
            storageExecutor.execute(() -> resolveAndAdmit(name, connectionHandle));
        } catch (RejectedExecutionException e) {
            pendingJoins.remove(connectionHandle, name);
            log.warn("存储线程池已满，拒绝加入匹配: handle={}, conn={}", name, connectionHandle);
            throw new SessionRejectedException(RejectCode.UNAVAILABLE, null, GameMessages.JOIN_UNAVAILABLE);
        }
    }

    /** 存储线程：解析玩家档案，再切回事件循环排队 */
    private void resolveAndAdmit(String name, String connectionHandle) {
        PlayerProfile profile;
        try {
            profile = playerDirectory.createOrGet(name);
        } catch (RuntimeException e) {
            log.warn("解析玩家档案失败: handle={}", name, e);
            eventLoop.execute("join-failed", () -> {
                if (pendingJoins.remove(connectionHandle, name)) {
                    safely("notify rejected", () -> notifier.moveRejected(connectionHandle, null,
                            RejectCode.UNAVAILABLE, GameMessages.JOIN_UNAVAILABLE));
                }
            });
            return;
        }
        eventLoop.execute("join-queue", () -> admit(name, profile, connectionHandle));
    }

    /**
     * 事件循环：完成排队。期间连接已断开或又换了昵称时，本次加入作废。
     */
    private void admit(String name, PlayerProfile profile, String connectionHandle) {
        if (!pendingJoins.remove(connectionHandle, name)) {
            log.debug("加入请求已失效，忽略: handle={}, conn={}", name, connectionHandle);
            return;
        }
        try {
            requireConnectionFree(connectionHandle);
            Optional<Session> seated = registry.findByParticipant(profile.id()).filter(Session::isInProgress);
            if (seated.isPresent()) {
                throw new SessionRejectedException(RejectCode.ALREADY_IN_SESSION, seated.get().getId(),
                        GameMessages.formatAlreadyInSession(seated.get().getId()));
            }
        } catch (SessionRejectedException e) {
            log.info("加入匹配被拒绝: handle={}, conn={}, code={}", name, connectionHandle, e.getCode());
            safely("notify rejected", () -> notifier.moveRejected(connectionHandle, e.getSessionId(), e.getCode(), e.getMessage()));
            return;
        }

        // 同一连接换昵称重新排队：先撤掉旧条目，避免一个连接占两个位置
        queue.findByConnection(connectionHandle)
                .filter(old -> !old.participantId().equals(profile.id()))
                .ifPresent(old -> {
                    queue.leave(connectionHandle);
                    log.info("连接换昵称重新排队，移除旧条目: conn={}, old={}", connectionHandle, old.participantId());
                });

        long now = clock.millis();
        Participant me = Participant.human(profile.id(), name, connectionHandle, now);
        me.setGamesWon(profile.gamesWon());
        me.setGamesLost(profile.gamesLost());

        JoinResult result = queue.join(me, now);
        switch (result.type()) {
            case PAIRED -> {
                QueueEntry waiting = result.opponent();
                log.info("匹配成功: {} vs {}", waiting.participantId(), me.getId());
                startSession(waiting.getParticipant(), result.entry().getParticipant());
            }
            case QUEUED -> {
                QueueEntry entry = result.entry();
                long timeoutSec = props.getMatchmaking().getTimeoutSeconds();
                countdown.start("queue:" + me.getId(), me.getId(), entry.getEnqueuedAt() + timeoutSec * 1000L,
                        String.valueOf(entry.getTicket()),
                        (key, owner, version) -> onMatchmakingTimeout(owner, Long.parseLong(version)));
                log.info("进入匹配队列: participantId={}, ticket={}, queueSize={}", me.getId(), entry.getTicket(), queue.size());
                safely("notify queued", () -> notifier.queued(connectionHandle, timeoutSec));
            }
            case REQUEUED -> {
                QueueEntry entry = result.entry();
                long remainingMs = entry.getEnqueuedAt() + props.getMatchmaking().getTimeoutSeconds() * 1000L - now;
                safely("notify queued", () -> notifier.queued(connectionHandle, Math.max(0L, remainingMs / 1000L)));
            }
        }
    }

    @Override
    public void onMatchmakingTimeout(String participantId, long ticket) {
        Optional<QueueEntry> expired = queue.onTimeoutExpire(participantId, ticket);
        if (expired.isEmpty()) {
            log.debug("匹配超时已过期，忽略: participantId={}, ticket={}", participantId, ticket);
            return;
        }
        log.info("匹配超时，改为与 AI 对战: participantId={}", participantId);
        String sessionId = newSessionId();
        startSession(sessionId, expired.get().getParticipant(), Participant.ai(sessionId, clock.millis()));
    }

    private void startSession(Participant first, Participant second) {
        startSession(newSessionId(), first, second);
    }

    private void startSession(String sessionId, Participant first, Participant second) {
        Session session = new Session(sessionId, first.copy(), second.copy(), clock.millis());
        registry.register(session);
        log.info("对局开始: sessionId={}, first={}, second={}, vsAi={}",
                sessionId, first.getId(), second.getId(), session.hasAi());

        SessionSnapshot snap = SessionSnapshot.of(session);
        for (Participant p : session.participants()) {
            if (p.isAi() || p.getConnectionHandle() == null) continue;
            Participant opp = session.opponentOf(p.getId());
            safely("notify started", () -> notifier.sessionStarted(p.getConnectionHandle(), snap, p.getId(), opp.getId(), opp.isAi()));
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("first", first.getId());
        data.put("second", second.getId());
        data.put("vsAi", session.hasAi());
        emit(GameLifecycleEvent.of(sessionId, EventType.GAME_START, null, data));

        maybeScheduleAi(session);
    }

    // ========== 落子 ==========

    @Override
    public void submitMove(String sessionId, String connectionHandle, int column) {
        Session session = requireActive(sessionId);
        Participant mover = session.byConnection(connectionHandle)
                .filter(p -> p.getId().equals(session.getTurn()))
                .orElseThrow(() -> new SessionRejectedException(RejectCode.OUT_OF_TURN, sessionId, GameMessages.NOT_YOUR_TURN));
        applyMove(session, mover, column);
    }

    @Override
    public void onAiTurn(String sessionId, int expectedMoveCount) {
        Session session = registry.find(sessionId).orElse(null);
        if (session == null || !session.isInProgress()) return;
        Participant current = session.currentParticipant();
        if (current == null || !current.isAi() || session.getMoves().size() != expectedMoveCount) {
            log.debug("AI 回合已过期，忽略: sessionId={}, expectedMoves={}", sessionId, expectedMoveCount);
            return;
        }
        Participant opponent = session.opponentOf(current.getId());
        BotMove choice = aiAdvisor.suggest(session.getBoard(), current.getId(), opponent.getId());
        log.debug("AI 选择: sessionId={}, column={}, score={}, reason={}",
                sessionId, choice.column(), choice.score(), choice.reasoning());
        if (choice.isPass()) {
            log.warn("AI 无可落子列: sessionId={}", sessionId);
            return;
        }
        applyMove(session, current, choice.column());
    }

    /**
     * 落子主流程（人类与 AI 共用）：合法性 → 落子 → 记谱 → 判胜/和 → 换手。
     */
    private void applyMove(Session session, Participant mover, int column) {
        if (!ConnectFourJudge.isLegal(session.getBoard(), column)) {
            throw new SessionRejectedException(RejectCode.ILLEGAL_MOVE, session.getId(),
                    GameMessages.formatIllegalColumn(column));
        }
        long now = clock.millis();
        int row = ConnectFourJudge.applyMove(session.getBoard(), column, mover.getId());
        Move move = session.appendMove(mover.getId(), column, row, now);
        mover.setLastSeen(now);

        Optional<String> winner = ConnectFourJudge.detectWinner(session.getBoard());
        boolean draw = winner.isEmpty() && ConnectFourJudge.isFull(session.getBoard());
        if (winner.isEmpty() && !draw) {
            session.flipTurn();
        }

        SessionSnapshot snap = SessionSnapshot.of(session);
        String nextTurn = winner.isPresent() || draw ? null : session.getTurn();
        forEachConnectedHuman(session, p -> notifier.moveApplied(p.getConnectionHandle(), snap, move, nextTurn));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seq", move.seq());
        data.put("column", column);
        data.put("row", row);
        emit(GameLifecycleEvent.of(session.getId(), EventType.MOVE_MADE, mover.getId(), data));

        if (winner.isPresent()) {
            endSession(session, SessionStatus.COMPLETED, Outcome.winner(winner.get()), EndReason.WIN);
        } else if (draw) {
            endSession(session, SessionStatus.COMPLETED, Outcome.ofDraw(), EndReason.DRAW);
        } else {
            maybeScheduleAi(session);
        }
    }

    private void maybeScheduleAi(Session session) {
        Participant next = session.currentParticipant();
        if (!session.isInProgress() || next == null || !next.isAi()) return;
        int expected = session.getMoves().size();
        countdown.start("ai:" + session.getId(), next.getId(), clock.millis() + props.getAi().getThinkDelayMs(),
                String.valueOf(expected),
                (key, owner, version) -> onAiTurn(session.getId(), Integer.parseInt(version)));
    }

    // ========== 掉线 / 重连 / 弃局 ==========

    @Override
    public void onConnectionLost(String connectionHandle) {
        if (connectionHandle == null) return;
        pendingJoins.remove(connectionHandle);
        Optional<QueueEntry> left = queue.leave(connectionHandle);
        if (left.isPresent()) {
            log.info("排队中的连接断开，已出队: participantId={}, conn={}", left.get().participantId(), connectionHandle);
            return;
        }

        Session session = registry.findByConnection(connectionHandle).orElse(null);
        if (session == null || !session.isInProgress()) return;
        Participant p = session.byConnection(connectionHandle).orElse(null);
        if (p == null) return;

        long now = clock.millis();
        p.setConnected(false);
        p.setConnectionHandle(null);
        p.setLastSeen(now);
        p.setDisconnectVersion(p.getDisconnectVersion() + 1);
        registry.unbindConnection(connectionHandle);

        long graceSec = props.getReconnect().getGraceSeconds();
        String sessionId = session.getId();
        countdown.start("abandon:" + sessionId + ":" + p.getId(), p.getId(), now + graceSec * 1000L,
                String.valueOf(p.getDisconnectVersion()),
                (key, owner, version) -> onAbandonTimeout(sessionId, owner, Integer.parseInt(version)));
        log.info("玩家掉线，保留座位 {} 秒: sessionId={}, participantId={}", graceSec, sessionId, p.getId());

        Participant opp = session.opponentOf(p.getId());
        if (!opp.isAi() && opp.isConnected()) {
            safely("notify disconnect", () -> notifier.opponentDisconnected(opp.getConnectionHandle(), sessionId, p.getId(), graceSec));
        }
        emit(GameLifecycleEvent.of(sessionId, EventType.PLAYER_DISCONNECT, p.getId()));
    }

    @Override
    public void rejoin(String sessionId, String handle, String newConnectionHandle) {
        if (StringUtils.isBlank(sessionId)) {
            throw new SessionRejectedException(RejectCode.BAD_REQUEST, null, GameMessages.SESSION_ID_REQUIRED);
        }
        if (StringUtils.isBlank(handle)) {
            throw new SessionRejectedException(RejectCode.BAD_REQUEST, sessionId, GameMessages.HANDLE_REQUIRED);
        }
        Session session = requireActive(sessionId);
        Participant p = session.humanByHandle(handle.trim())
                .orElseThrow(() -> new SessionRejectedException(RejectCode.NOT_FOUND, sessionId,
                        GameMessages.formatNotAParticipant(handle)));
        Optional<Session> elsewhere = registry.findByConnection(newConnectionHandle)
                .filter(other -> !other.getId().equals(sessionId))
                .filter(Session::isInProgress);
        if (elsewhere.isPresent()) {
            throw new SessionRejectedException(RejectCode.ALREADY_IN_SESSION, elsewhere.get().getId(),
                    GameMessages.formatConnectionInSession(elsewhere.get().getId()));
        }

        // 新连接若还挂着排队条目或未完成的加入请求，一并撤掉
        pendingJoins.remove(newConnectionHandle);
        queue.leave(newConnectionHandle).ifPresent(e ->
                log.info("重连的连接原在排队，已出队: conn={}, participantId={}", newConnectionHandle, e.participantId()));

        String old = p.getConnectionHandle();
        if (old != null && !old.equals(newConnectionHandle)) {
            registry.unbindConnection(old);
        }
        p.setConnectionHandle(newConnectionHandle);
        p.setConnected(true);
        p.setLastSeen(clock.millis());
        registry.bindConnection(newConnectionHandle, sessionId);
        log.info("玩家重连: sessionId={}, participantId={}, conn={}", sessionId, p.getId(), newConnectionHandle);

        Participant opp = session.opponentOf(p.getId());
        SessionSnapshot snap = SessionSnapshot.of(session);
        safely("notify rejoined", () -> notifier.sessionRejoined(newConnectionHandle, snap, p.getId(), opp.getId()));
        if (!opp.isAi() && opp.isConnected()) {
            safely("notify reconnect", () -> notifier.opponentReconnected(opp.getConnectionHandle(), sessionId, p.getId()));
        }
        emit(GameLifecycleEvent.of(sessionId, EventType.PLAYER_RECONNECT, p.getId()));
    }

    @Override
    public void onAbandonTimeout(String sessionId, String participantId, int disconnectVersion) {
        Session session = registry.find(sessionId).orElse(null);
        if (session == null || !session.isInProgress()) return;
        Participant p = session.participant(participantId);
        if (p == null || p.isConnected() || p.getDisconnectVersion() != disconnectVersion) {
            log.debug("弃局倒计时已失效: sessionId={}, participantId={}, version={}", sessionId, participantId, disconnectVersion);
            return;
        }
        Participant winner = session.opponentOf(participantId);
        log.info("掉线超时判负: sessionId={}, loser={}, winner={}", sessionId, participantId, winner.getId());
        endSession(session, SessionStatus.ABANDONED, Outcome.winner(winner.getId()), EndReason.ABANDONED);
    }

    // ========== 结束 ==========

    private void endSession(Session session, SessionStatus status, Outcome outcome, EndReason reason) {
        long now = clock.millis();
        session.finish(status, outcome, now);
        log.info("对局结束: sessionId={}, status={}, reason={}, winner={}, moves={}",
                session.getId(), status, reason, outcome.winnerId(), session.getMoves().size());

        recordStats(session, outcome, reason);
        FinalizedSession record = FinalizedSession.of(session, reason.label());
        offLoop("persist session " + session.getId(), () -> archive.persist(record));

        SessionSnapshot snap = SessionSnapshot.of(session);
        forEachConnectedHuman(session, p -> notifier.sessionEnded(p.getConnectionHandle(), snap, outcome, reason));
        registry.terminate(session);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("winner", outcome.draw() ? "draw" : outcome.winnerId());
        data.put("reason", reason.label());
        data.put("totalMoves", session.getMoves().size());
        data.put("durationMs", now - session.getCreatedAt());
        emit(GameLifecycleEvent.of(session.getId(), EventType.GAME_END, null, data));

        String sessionId = session.getId();
        countdown.start("evict:" + sessionId, sessionId, now + props.getSession().getRetentionMinutes() * 60_000L, "0",
                (key, owner, version) -> registry.evict(owner));
    }

    /**
     * 和棋不计；AI 因对手掉线获胜时双方都不计；其余只给人类参与者记胜负。
     */
    private void recordStats(Session session, Outcome outcome, EndReason reason) {
        if (outcome.winnerId() == null) return;
        Participant winner = session.participant(outcome.winnerId());
        if (reason == EndReason.ABANDONED && winner != null && winner.isAi()) return;
        for (Participant p : session.participants()) {
            if (p.isAi()) continue;
            boolean won = p.getId().equals(outcome.winnerId());
            if (won) p.setGamesWon(p.getGamesWon() + 1);
            else p.setGamesLost(p.getGamesLost() + 1);
            String id = p.getId();
            String handle = p.getHandle();
            offLoop("record stats " + id, () -> playerDirectory.recordResult(id, handle, won));
        }
    }

    // ========== 查询 ==========

    @Override
    public Optional<SessionSnapshot> snapshot(String sessionId) {
        return registry.find(sessionId).map(SessionSnapshot::of);
    }

    // ========== 工具 ==========

    /** 连接已坐在某个进行中的对局里时拒绝 */
    private void requireConnectionFree(String connectionHandle) {
        Optional<Session> bound = registry.findByConnection(connectionHandle).filter(Session::isInProgress);
        if (bound.isPresent()) {
            throw new SessionRejectedException(RejectCode.ALREADY_IN_SESSION, bound.get().getId(),
                    GameMessages.formatConnectionInSession(bound.get().getId()));
        }
    }

    private Session requireActive(String sessionId) {
        Session session = registry.find(sessionId)
                .orElseThrow(() -> new SessionRejectedException(RejectCode.NOT_FOUND, sessionId,
                        GameMessages.formatNotFound(sessionId)));
        if (!session.isInProgress()) {
            throw new SessionRejectedException(RejectCode.SESSION_NOT_ACTIVE, sessionId,
                    GameMessages.formatNotActive(session.getStatus().name()));
        }
        return session;
    }

    private void forEachConnectedHuman(Session session, Consumer<Participant> action) {
        for (Participant p : session.participants()) {
            if (p.isAi() || !p.isConnected() || p.getConnectionHandle() == null) continue;
            safely("notify " + p.getId(), () -> action.accept(p));
        }
    }

    private void emit(GameLifecycleEvent event) {
        safely("publish " + event.getEventType(), () -> eventSink.publish(event));
    }

    /** 交给存储线程执行；线程池积压时放弃并记日志 */
    private void offLoop(String what, Runnable action) {
        try {
            storageExecutor.execute(() -> safely(what, action));
        } catch (RejectedExecutionException e) {
            log.warn("存储线程池已满，已放弃: {}", what);
        }
    }

    private void safely(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("外部协作方调用失败，已忽略: {}", what, e);
        }
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }
}
