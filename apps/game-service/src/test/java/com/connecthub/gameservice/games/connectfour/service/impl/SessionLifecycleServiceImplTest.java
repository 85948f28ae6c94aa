package com.connecthub.gameservice.games.connectfour.service.impl;

import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent;
import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent.EventType;
import com.connecthub.gameservice.clock.scheduler.CountdownScheduler;
import com.connecthub.gameservice.games.connectfour.application.LifecycleEventSink;
import com.connecthub.gameservice.games.connectfour.application.MatchmakingQueue;
import com.connecthub.gameservice.games.connectfour.application.SessionNotifier;
import com.connecthub.gameservice.games.connectfour.application.SessionRegistry;
import com.connecthub.gameservice.games.connectfour.application.player.PlayerDirectoryService;
import com.connecthub.gameservice.games.connectfour.application.player.PlayerProfile;
import com.connecthub.gameservice.games.connectfour.domain.ai.ConnectFourAI;
import com.connecthub.gameservice.games.connectfour.domain.enums.EndReason;
import com.connecthub.gameservice.games.connectfour.domain.enums.RejectCode;
import com.connecthub.gameservice.games.connectfour.domain.exception.SessionRejectedException;
import com.connecthub.gameservice.games.connectfour.domain.model.FinalizedSession;
import com.connecthub.gameservice.games.connectfour.domain.model.Session;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionStatus;
import com.connecthub.gameservice.games.connectfour.domain.repository.SessionArchive;
import com.connecthub.gameservice.platform.config.ConnectFourProperties;
import com.connecthub.gameservice.platform.loop.SessionEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 对局生命周期：匹配、落子、掉线重连、弃局、AI 回合。
 * 倒计时用手动推进的调度器代替，时钟可控；
 * 事件循环与存储线程默认就地执行，需要观察异步顺序时可让存储线程先挂起。
 */
@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceImplTest {

    /** 一局合法交替落子、以满盘和棋收尾的列序列（先手开始） */
    private static final int[] DRAW_SEQUENCE = {
            5, 3, 2, 3, 1, 5, 3, 1, 0, 1, 4, 1, 2, 5, 0, 5, 6, 6, 2, 0, 6,
            0, 4, 2, 3, 0, 3, 4, 2, 3, 2, 6, 0, 4, 1, 1, 5, 4, 4, 5, 6, 6
    };

    @Mock
    private SessionNotifier notifier;

    @Mock
    private SessionArchive archive;

    @Mock
    private LifecycleEventSink eventSink;

    @Mock
    private PlayerDirectoryService playerDirectory;

    @Mock
    private SessionEventLoop eventLoop;

    private MatchmakingQueue queue;
    private SessionRegistry registry;
    private MutableClock clock;
    private ManualCountdown countdown;
    private HoldableExecutor storage;
    private SessionLifecycleServiceImpl service;

    @BeforeEach
    void setUp() {
        queue = new MatchmakingQueue();
        registry = new SessionRegistry();
        clock = new MutableClock(1_700_000_000_000L);
        countdown = new ManualCountdown(clock);
        storage = new HoldableExecutor();
        ConnectFourProperties props = new ConnectFourProperties();
        props.getAi().setSearchDepth(3);

        lenient().when(playerDirectory.createOrGet(anyString()))
                .thenAnswer(inv -> {
                    String handle = inv.getArgument(0);
                    return new PlayerProfile("p_" + handle, handle, 0, 0);
                });

        lenient().doAnswer(inv -> {
            inv.<Runnable>getArgument(1).run();
            return null;
        }).when(eventLoop).execute(anyString(), any(Runnable.class));

        service = new SessionLifecycleServiceImpl(queue, registry, notifier, archive, eventSink,
                playerDirectory, countdown, props, clock, new ConnectFourAI(props.getAi().getSearchDepth()),
                eventLoop, storage);
    }

    // ==============================
    // MATCHMAKING
    // ==============================

    @Nested
    @DisplayName("匹配")
    class Matchmaking {

        @Test
        @DisplayName("两名玩家先后加入即开局，先到者执先")
        void pairsTwoHumans() {
            service.joinQueue("alice", "c-a");
            verify(notifier).queued("c-a", 10L);

            service.joinQueue("bob", "c-b");

            Session s = sessionOf("p_alice");
            assertThat(s.getFirst().getId()).isEqualTo("p_alice");
            assertThat(s.getTurn()).isEqualTo("p_alice");
            assertThat(s.hasAi()).isFalse();
            assertThat(queue.size()).isZero();
            verify(notifier).sessionStarted(eq("c-a"), any(), eq("p_alice"), eq("p_bob"), eq(false));
            verify(notifier).sessionStarted(eq("c-b"), any(), eq("p_bob"), eq("p_alice"), eq(false));
            assertThat(emitted(EventType.GAME_START)).hasSize(1);
        }

        @Test
        @DisplayName("超时无人匹配则与 AI 开局，人类执先")
        void fallsBackToAi() {
            service.joinQueue("alice", "c-a");

            clock.advance(10_000L);
            countdown.fireDue();

            Session s = sessionOf("p_alice");
            assertThat(s.hasAi()).isTrue();
            assertThat(s.getTurn()).isEqualTo("p_alice");
            assertThat(s.getSecond().getId()).isEqualTo("bot_" + s.getId());
            verify(notifier).sessionStarted(eq("c-a"), any(), eq("p_alice"), eq("bot_" + s.getId()), eq(true));
        }

        @Test
        @DisplayName("已配对后超时回调不会再创建对局")
        void timeoutAfterPairingIsNoop() {
            service.joinQueue("alice", "c-a");
            service.joinQueue("bob", "c-b");

            clock.advance(10_000L);
            countdown.fireDue();

            assertThat(registry.size()).isEqualTo(1);
            assertThat(sessionOf("p_alice").hasAi()).isFalse();
        }

        @Test
        @DisplayName("排队中断开连接即出队，超时不再开局")
        void disconnectWhileQueued() {
            service.joinQueue("alice", "c-a");
            service.onConnectionLost("c-a");

            clock.advance(10_000L);
            countdown.fireDue();

            assertThat(queue.size()).isZero();
            assertThat(registry.size()).isZero();
            verify(notifier, never()).sessionStarted(anyString(), any(), anyString(), anyString(), anyBoolean());
        }

        @Test
        @DisplayName("重复加入保留原排队位置，不再额外计时")
        void duplicateJoin() {
            service.joinQueue("alice", "c-a");
            clock.advance(4_000L);
            service.joinQueue("alice", "c-a2");

            assertThat(queue.size()).isEqualTo(1);
            assertThat(countdown.pendingCount()).isEqualTo(1);
            verify(notifier).queued("c-a2", 6L);
        }

        @Test
        @DisplayName("对局进行中再次加入被拒绝，空昵称被拒绝")
        void rejectsInvalidJoins() {
            service.joinQueue("alice", "c-a");
            service.joinQueue("bob", "c-b");
            String sid = sessionOf("p_alice").getId();

            service.joinQueue("alice", "c-a3");
            verify(notifier).moveRejected(eq("c-a3"), eq(sid), eq(RejectCode.ALREADY_IN_SESSION), anyString());

            assertRejected(() -> service.joinQueue("  ", "c-z"), RejectCode.BAD_REQUEST);
            assertThat(queue.size()).isZero();
        }

        @Test
        @DisplayName("已在对局中的连接换昵称排队被拒绝，掉线后原对局照常弃局")
        void seatedConnectionCannotQueueAgain() {
            service.joinQueue("alice", "c-a");
            service.joinQueue("bob", "c-b");
            Session first = sessionOf("p_alice");

            assertRejected(() -> service.joinQueue("carol", "c-a"), RejectCode.ALREADY_IN_SESSION);
            assertThat(queue.size()).isZero();

            service.joinQueue("dave", "c-d");
            service.onConnectionLost("c-a");
            assertThat(first.getFirst().isConnected()).isFalse();

            clock.advance(60_000L);
            countdown.fireDue();

            assertThat(first.getStatus()).isEqualTo(SessionStatus.ABANDONED);
            assertThat(first.getOutcome().winnerId()).isEqualTo("p_bob");
            assertThat(registry.findByParticipant("p_carol")).isEmpty();
        }

        @Test
        @DisplayName("解析玩家档案期间连接断开，本次加入作废")
        void disconnectWhileResolvingPlayer() {
            storage.hold();
            service.joinQueue("alice", "c-a");
            service.onConnectionLost("c-a");
            storage.drain();

            assertThat(queue.size()).isZero();
            verify(notifier, never()).queued(anyString(), anyLong());
            assertThat(countdown.pendingCount()).isZero();
        }

        @Test
        @DisplayName("玩家目录异常时回推 UNAVAILABLE，不入队")
        void directoryFailureRejectsJoin() {
            when(playerDirectory.createOrGet("zed")).thenThrow(new IllegalStateException("redis down"));

            service.joinQueue("zed", "c-z");

            verify(notifier).moveRejected(eq("c-z"), any(), eq(RejectCode.UNAVAILABLE), anyString());
            assertThat(queue.size()).isZero();
        }
    }

    // ==============================
    // MOVES
    // ==============================

    @Nested
    @DisplayName("落子")
    class Moves {

        private String sid;

        @BeforeEach
        void pair() {
            service.joinQueue("alice", "c-a");
            service.joinQueue("bob", "c-b");
            sid = sessionOf("p_alice").getId();
        }

        @Test
        @DisplayName("每步成功落子后回合交替一次")
        void alternatesTurn() {
            service.submitMove(sid, "c-a", 3);
            assertThat(session().getTurn()).isEqualTo("p_bob");

            service.submitMove(sid, "c-b", 3);
            assertThat(session().getTurn()).isEqualTo("p_alice");
            assertThat(session().getMoves()).hasSize(2);
            verify(notifier, atLeastOnce()).moveApplied(eq("c-b"), any(), any(), eq("p_alice"));
        }

        @Test
        @DisplayName("非当前回合落子被拒绝，棋盘与回合不变")
        void outOfTurnDoesNotMutate() {
            assertRejected(() -> service.submitMove(sid, "c-b", 3), RejectCode.OUT_OF_TURN);
            assertRejected(() -> service.submitMove(sid, "c-stranger", 3), RejectCode.OUT_OF_TURN);

            assertThat(session().getBoard().filledCount()).isZero();
            assertThat(session().getTurn()).isEqualTo("p_alice");
        }

        @Test
        @DisplayName("越界与满列被拒绝")
        void illegalColumns() {
            assertRejected(() -> service.submitMove(sid, "c-a", 7), RejectCode.ILLEGAL_MOVE);
            for (int i = 0; i < 6; i++) {
                service.submitMove(sid, i % 2 == 0 ? "c-a" : "c-b", 0);
            }
            assertRejected(() -> service.submitMove(sid, "c-a", 0), RejectCode.ILLEGAL_MOVE);
            assertThat(session().getMoves()).hasSize(6);
            assertThat(session().getTurn()).isEqualTo("p_alice");
        }

        @Test
        @DisplayName("连成四子即结束：归档、记战绩、通知双方")
        void winEndsSession() {
            playColumns(0, 1, 0, 1, 0, 1, 0);

            Session s = session();
            assertThat(s.getStatus()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(s.getOutcome().winnerId()).isEqualTo("p_alice");

            ArgumentCaptor<FinalizedSession> record = ArgumentCaptor.forClass(FinalizedSession.class);
            verify(archive).persist(record.capture());
            assertThat(record.getValue().getEndReason()).isEqualTo("win");
            assertThat(record.getValue().getMoves()).hasSize(7);

            verify(playerDirectory).recordResult("p_alice", "alice", true);
            verify(playerDirectory).recordResult("p_bob", "bob", false);
            verify(notifier).sessionEnded(eq("c-a"), any(), any(), eq(EndReason.WIN));
            verify(notifier).sessionEnded(eq("c-b"), any(), any(), eq(EndReason.WIN));

            GameLifecycleEvent end = emitted(EventType.GAME_END).get(0);
            assertThat(end.getData()).containsEntry("winner", "p_alice").containsEntry("totalMoves", 7);
        }

        @Test
        @DisplayName("结束后的重复提交得到 SESSION_NOT_ACTIVE，清理后得到 NOT_FOUND")
        void submitAfterEnd() {
            playColumns(0, 1, 0, 1, 0, 1, 0);

            assertRejected(() -> service.submitMove(sid, "c-b", 1), RejectCode.SESSION_NOT_ACTIVE);
            assertThat(service.snapshot(sid)).isPresent();

            clock.advance(10 * 60_000L);
            countdown.fireDue();

            assertRejected(() -> service.submitMove(sid, "c-b", 1), RejectCode.NOT_FOUND);
            assertThat(service.snapshot(sid)).isEmpty();
        }

        @Test
        @DisplayName("满盘无连线为和棋，不计战绩")
        void fullBoardIsDraw() {
            playColumns(DRAW_SEQUENCE);

            Session s = session();
            assertThat(s.getStatus()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(s.getOutcome().draw()).isTrue();
            verify(notifier).sessionEnded(eq("c-a"), any(), any(), eq(EndReason.DRAW));
            verify(playerDirectory, never()).recordResult(anyString(), anyString(), anyBoolean());
        }

        @Test
        @DisplayName("归档与事件出口失败不影响对局结束")
        void collaboratorFailuresAreSuppressed() {
            doThrow(new IllegalStateException("redis down")).when(archive).persist(any());
            doThrow(new IllegalStateException("kafka down")).when(eventSink).publish(any());

            playColumns(0, 1, 0, 1, 0, 1, 0);

            assertThat(session().getStatus()).isEqualTo(SessionStatus.COMPLETED);
            verify(notifier).sessionEnded(eq("c-b"), any(), any(), eq(EndReason.WIN));
        }

        @Test
        @DisplayName("归档与战绩写入交给存储线程，对局结束不等待它们")
        void storageRunsOffLoop() {
            storage.hold();

            playColumns(0, 1, 0, 1, 0, 1, 0);

            assertThat(session().getStatus()).isEqualTo(SessionStatus.COMPLETED);
            verify(notifier).sessionEnded(eq("c-a"), any(), any(), eq(EndReason.WIN));
            verify(archive, never()).persist(any());
            verify(playerDirectory, never()).recordResult(anyString(), anyString(), anyBoolean());
            assertThat(storage.heldCount()).isEqualTo(3);

            storage.drain();

            verify(archive).persist(any());
            verify(playerDirectory).recordResult("p_alice", "alice", true);
            verify(playerDirectory).recordResult("p_bob", "bob", false);
        }

        private void playColumns(int... columns) {
            for (int i = 0; i < columns.length; i++) {
                service.submitMove(sid, i % 2 == 0 ? "c-a" : "c-b", columns[i]);
            }
        }

        private Session session() {
            return registry.find(sid).orElseThrow();
        }
    }

    // ==============================
    // DISCONNECT / REJOIN / ABANDON
    // ==============================

    @Nested
    @DisplayName("掉线与重连")
    class Presence {

        private String sid;

        @BeforeEach
        void pair() {
            service.joinQueue("alice", "c-a");
            service.joinQueue("bob", "c-b");
            sid = sessionOf("p_alice").getId();
            service.submitMove(sid, "c-a", 3);
        }

        @Test
        @DisplayName("宽限期内重连：恢复在线，棋盘回合棋谱不变，弃局不触发")
        void rejoinWithinGrace() {
            Session s = registry.find(sid).orElseThrow();
            String[][] board = s.getBoard().view();

            service.onConnectionLost("c-b");
            assertThat(s.getSecond().isConnected()).isFalse();
            verify(notifier).opponentDisconnected("c-a", sid, "p_bob", 30L);

            clock.advance(5_000L);
            service.rejoin(sid, "bob", "c-b2");

            assertThat(s.getSecond().isConnected()).isTrue();
            assertThat(s.getBoard().view()).isDeepEqualTo(board);
            assertThat(s.getTurn()).isEqualTo("p_bob");
            assertThat(s.getMoves()).hasSize(1);
            verify(notifier).sessionRejoined(eq("c-b2"), any(), eq("p_bob"), eq("p_alice"));
            verify(notifier).opponentReconnected("c-a", sid, "p_bob");

            clock.advance(30_000L);
            countdown.fireDue();
            assertThat(s.isInProgress()).isTrue();

            service.submitMove(sid, "c-b2", 4);
            assertThat(s.getTurn()).isEqualTo("p_alice");
        }

        @Test
        @DisplayName("宽限期结束仍未重连：判弃局，在线一方获胜")
        void abandonAfterGrace() {
            service.onConnectionLost("c-b");

            clock.advance(30_000L);
            countdown.fireDue();

            Session s = registry.find(sid).orElseThrow();
            assertThat(s.getStatus()).isEqualTo(SessionStatus.ABANDONED);
            assertThat(s.getOutcome().winnerId()).isEqualTo("p_alice");
            verify(notifier).sessionEnded(eq("c-a"), any(), any(), eq(EndReason.ABANDONED));
            verify(notifier, never()).sessionEnded(eq("c-b"), any(), any(), any());
            verify(playerDirectory).recordResult("p_alice", "alice", true);
            verify(playerDirectory).recordResult("p_bob", "bob", false);

            assertRejected(() -> service.rejoin(sid, "bob", "c-b2"), RejectCode.SESSION_NOT_ACTIVE);
        }

        @Test
        @DisplayName("重连后再次掉线，旧倒计时到期不生效")
        void staleAbandonTimerIgnored() {
            service.onConnectionLost("c-b");
            clock.advance(10_000L);
            service.rejoin(sid, "bob", "c-b2");
            clock.advance(10_000L);
            service.onConnectionLost("c-b2");

            clock.advance(10_000L);
            countdown.fireDue();
            Session s = registry.find(sid).orElseThrow();
            assertThat(s.isInProgress()).isTrue();

            clock.advance(20_000L);
            countdown.fireDue();
            assertThat(s.getStatus()).isEqualTo(SessionStatus.ABANDONED);
        }

        @Test
        @DisplayName("双方都掉线并在宽限期内重连：两个弃局倒计时都失效")
        void bothRejoinWithinGrace() {
            Session s = registry.find(sid).orElseThrow();
            service.onConnectionLost("c-a");
            service.onConnectionLost("c-b");
            assertThat(s.getFirst().isConnected()).isFalse();
            assertThat(s.getSecond().isConnected()).isFalse();

            clock.advance(10_000L);
            service.rejoin(sid, "alice", "c-a2");
            service.rejoin(sid, "bob", "c-b2");

            clock.advance(30_000L);
            countdown.fireDue();

            assertThat(s.isInProgress()).isTrue();
            assertThat(s.getFirst().isConnected()).isTrue();
            assertThat(s.getSecond().isConnected()).isTrue();
            assertThat(s.getMoves()).hasSize(1);
            assertThat(s.getTurn()).isEqualTo("p_bob");
            verify(notifier, never()).sessionEnded(anyString(), any(), any(), any());

            service.submitMove(sid, "c-b2", 4);
            assertThat(s.getMoves()).hasSize(2);
        }

        @Test
        @DisplayName("新连接已坐在另一局进行中的对局里时不能用于重连")
        void rejoinOnConnectionSeatedElsewhere() {
            service.joinQueue("carol", "c-c");
            service.joinQueue("dave", "c-d");
            String other = sessionOf("p_carol").getId();
            service.onConnectionLost("c-b");

            assertRejected(() -> service.rejoin(sid, "bob", "c-c"), RejectCode.ALREADY_IN_SESSION);

            Session s = registry.find(sid).orElseThrow();
            assertThat(s.getSecond().isConnected()).isFalse();
            assertThat(registry.findByConnection("c-c")).map(Session::getId).contains(other);
        }

        @Test
        @DisplayName("重连校验：缺少参数、非参与者")
        void rejoinValidation() {
            assertRejected(() -> service.rejoin(" ", "bob", "c-x"), RejectCode.BAD_REQUEST);
            assertRejected(() -> service.rejoin(sid, "", "c-x"), RejectCode.BAD_REQUEST);
            assertRejected(() -> service.rejoin(sid, "mallory", "c-x"), RejectCode.NOT_FOUND);
            assertRejected(() -> service.rejoin("missing", "bob", "c-x"), RejectCode.NOT_FOUND);
        }
    }

    // ==============================
    // AI
    // ==============================

    @Nested
    @DisplayName("AI 对局")
    class AiTurns {

        private String sid;

        @BeforeEach
        void startVsAi() {
            service.joinQueue("alice", "c-a");
            clock.advance(10_000L);
            countdown.fireDue();
            sid = sessionOf("p_alice").getId();
        }

        @Test
        @DisplayName("人类落子后 AI 在思考延迟后自动应答")
        void aiRespondsAfterDelay() {
            service.submitMove(sid, "c-a", 3);
            Session s = registry.find(sid).orElseThrow();
            assertThat(s.getTurn()).isEqualTo("bot_" + sid);

            clock.advance(600L);
            countdown.fireDue();

            assertThat(s.getMoves()).hasSize(2);
            assertThat(s.getMoves().get(1).participantId()).isEqualTo("bot_" + sid);
            assertThat(s.getTurn()).isEqualTo("p_alice");
        }

        @Test
        @DisplayName("棋局已变化时过期的 AI 回调不落子")
        void staleAiCallbackIgnored() {
            service.submitMove(sid, "c-a", 3);

            service.onAiTurn(sid, 0);

            assertThat(registry.find(sid).orElseThrow().getMoves()).hasSize(1);
        }

        @Test
        @DisplayName("AI 因对手掉线获胜时双方都不计战绩")
        void aiWinByAbandonSkipsStats() {
            service.onConnectionLost("c-a");
            clock.advance(30_000L);
            countdown.fireDue();

            Session s = registry.find(sid).orElseThrow();
            assertThat(s.getStatus()).isEqualTo(SessionStatus.ABANDONED);
            assertThat(s.getOutcome().winnerId()).isEqualTo("bot_" + sid);
            verify(playerDirectory, never()).recordResult(anyString(), anyString(), anyBoolean());
        }
    }

    // ---------- helpers ----------

    private Session sessionOf(String participantId) {
        return registry.findByParticipant(participantId)
                .orElseThrow(() -> new AssertionError("no session for " + participantId));
    }

    private List<GameLifecycleEvent> emitted(EventType type) {
        ArgumentCaptor<GameLifecycleEvent> captor = ArgumentCaptor.forClass(GameLifecycleEvent.class);
        verify(eventSink, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues().stream().filter(e -> e.getEventType() == type).toList();
    }

    private static void assertRejected(Runnable action, RejectCode code) {
        assertThatThrownBy(action::run)
                .isInstanceOf(SessionRejectedException.class)
                .extracting(e -> ((SessionRejectedException) e).getCode())
                .isEqualTo(code);
    }

    /** 默认就地执行；hold() 之后先攒起来，drain() 时再按顺序执行 */
    static final class HoldableExecutor implements Executor {
        private final Deque<Runnable> held = new ArrayDeque<>();
        private boolean holding;

        void hold() {
            holding = true;
        }

        void drain() {
            holding = false;
            while (!held.isEmpty()) {
                held.pollFirst().run();
            }
        }

        int heldCount() {
            return held.size();
        }

        @Override
        public void execute(Runnable command) {
            if (holding) held.addLast(command);
            else command.run();
        }
    }

    /** 可手动推进的时钟 */
    static final class MutableClock extends Clock {
        private long now;

        MutableClock(long now) {
            this.now = now;
        }

        void advance(long ms) {
            now += ms;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            return now;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(now);
        }
    }

    /** 只记录不执行的倒计时，由测试按时钟手动触发到期项 */
    static final class ManualCountdown implements CountdownScheduler {
        private record Pending(String key, String owner, long deadline, String version, TimeoutHandler handler) {}

        private final Clock clock;
        private final List<Pending> pending = new ArrayList<>();

        ManualCountdown(Clock clock) {
            this.clock = clock;
        }

        @Override
        public void start(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
            pending.add(new Pending(key, owner, deadlineEpochMs, version, onTimeout));
        }

        @Override
        public int pendingCount() {
            return pending.size();
        }

        /** 依截止时间顺序触发所有已到期的倒计时（回调中新启动且已到期的也会触发） */
        void fireDue() {
            while (true) {
                Pending next = pending.stream()
                        .filter(p -> p.deadline() <= clock.millis())
                        .min(Comparator.comparingLong(Pending::deadline))
                        .orElse(null);
                if (next == null) return;
                pending.remove(next);
                next.handler().onTimeout(next.key(), next.owner(), next.version());
            }
        }
    }
}
