package com.connecthub.gameservice.games.connectfour.application;

import com.connecthub.gameservice.games.connectfour.domain.model.Participant;
import com.connecthub.gameservice.games.connectfour.domain.model.QueueEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/**
 * 匹配队列（FIFO）。
 * <p>
 * 仅在会话事件循环线程上访问，不加锁。
 * 超时不取消：超时回调带着入队时的 ticket 回来，队列里对不上就什么都不做。
 */
@Slf4j
@Component
public class MatchmakingQueue {

    private final Deque<QueueEntry> waiting = new ArrayDeque<>();
    private long ticketSeq = 0;

    /** 入队结果类型 */
    public enum JoinType {
        /** 新入队，需要调用方为其启动匹配超时 */
        QUEUED,
        /** 已在队列中，仅刷新连接句柄，位置与超时不变 */
        REQUEUED,
        /** 与最早的等待者配对成功 */
        PAIRED
    }

    /**
     * @param type     结果类型
     * @param entry    新来者的条目（PAIRED 时为未入队的临时条目）
     * @param opponent PAIRED 时为被取出的最早等待者，其余为 null
     */
    public record JoinResult(JoinType type, QueueEntry entry, QueueEntry opponent) {
    }

    /**
     * 加入匹配。
     * 同一参与者重复加入时原地替换：刷新连接句柄/昵称，保留排队位置、入队时间与 ticket。
     */
    public JoinResult join(Participant participant, long now) {
        QueueEntry existing = find(participant.getId()).orElse(null);
        if (existing != null) {
            existing.getParticipant().setConnectionHandle(participant.getConnectionHandle());
            existing.getParticipant().setHandle(participant.getHandle());
            existing.getParticipant().setConnected(true);
            log.debug("重复加入匹配，原地刷新: participantId={}, ticket={}", participant.getId(), existing.getTicket());
            return new JoinResult(JoinType.REQUEUED, existing, null);
        }

        QueueEntry entry = new QueueEntry(participant, now, ++ticketSeq);
        QueueEntry oldest = waiting.pollFirst();
        if (oldest != null) {
            return new JoinResult(JoinType.PAIRED, entry, oldest);
        }
        waiting.addLast(entry);
        return new JoinResult(JoinType.QUEUED, entry, null);
    }

    /**
     * 匹配超时回调。仅当同一参与者、同一 ticket 仍在队列中时将其取出（随后与 AI 开局），否则视为过期。
     */
    public Optional<QueueEntry> onTimeoutExpire(String participantId, long ticket) {
        Iterator<QueueEntry> it = waiting.iterator();
        while (it.hasNext()) {
            QueueEntry e = it.next();
            if (e.participantId().equals(participantId) && e.getTicket() == ticket) {
                it.remove();
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /** 连接在配对前断开：移除该连接的排队条目 */
    public Optional<QueueEntry> leave(String connectionHandle) {
        if (connectionHandle == null) return Optional.empty();
        Iterator<QueueEntry> it = waiting.iterator();
        while (it.hasNext()) {
            QueueEntry e = it.next();
            if (connectionHandle.equals(e.connectionHandle())) {
                it.remove();
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public Optional<QueueEntry> findByConnection(String connectionHandle) {
        if (connectionHandle == null) return Optional.empty();
        return waiting.stream().filter(e -> connectionHandle.equals(e.connectionHandle())).findFirst();
    }

    public Optional<QueueEntry> find(String participantId) {
        return waiting.stream().filter(e -> e.participantId().equals(participantId)).findFirst();
    }

    public boolean contains(String participantId) {
        return find(participantId).isPresent();
    }

    public int size() {
        return waiting.size();
    }
}
