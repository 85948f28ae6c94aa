package com.connecthub.gameservice.games.connectfour.application;

import com.connecthub.gameservice.games.connectfour.domain.model.Participant;
import com.connecthub.gameservice.games.connectfour.domain.model.Session;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 对局注册表：进程内唯一的对局存储。
 * <ul>
 *   <li>sessions：sessionId → Session（已结束的对局保留一段时间，供重复提交得到准确的拒绝原因）</li>
 *   <li>byParticipant：participantId → sessionId（仅进行中的对局）</li>
 *   <li>byConnection：connectionHandle → sessionId（仅在线的连接）</li>
 * </ul>
 * 只由生命周期服务在会话事件循环线程上调用。
 */
@Component
public class SessionRegistry {

    private final Map<String, Session> sessions = new HashMap<>();
    private final Map<String, String> byParticipant = new HashMap<>();
    private final Map<String, String> byConnection = new HashMap<>();

    /** 登记新对局并建立两名参与者的索引 */
    public void register(Session session) {
        if (sessions.containsKey(session.getId())) {
            throw new IllegalStateException("duplicate session id " + session.getId());
        }
        sessions.put(session.getId(), session);
        for (Participant p : session.participants()) {
            if (p.isAi()) continue;
            byParticipant.put(p.getId(), session.getId());
            if (p.getConnectionHandle() != null) {
                byConnection.put(p.getConnectionHandle(), session.getId());
            }
        }
    }

    public Optional<Session> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<Session> findByParticipant(String participantId) {
        String sid = byParticipant.get(participantId);
        return sid == null ? Optional.empty() : find(sid);
    }

    public Optional<Session> findByConnection(String connectionHandle) {
        String sid = connectionHandle == null ? null : byConnection.get(connectionHandle);
        return sid == null ? Optional.empty() : find(sid);
    }

    public void bindConnection(String connectionHandle, String sessionId) {
        byConnection.put(connectionHandle, sessionId);
    }

    public void unbindConnection(String connectionHandle) {
        if (connectionHandle != null) byConnection.remove(connectionHandle);
    }

    /** 对局结束：移除两类索引，对局本身留待 evict */
    public void terminate(Session session) {
        for (Participant p : session.participants()) {
            byParticipant.remove(p.getId(), session.getId());
            if (p.getConnectionHandle() != null) {
                byConnection.remove(p.getConnectionHandle(), session.getId());
            }
        }
    }

    /** 清除已结束的对局；进行中的对局不会被清除 */
    public boolean evict(String sessionId) {
        Session s = sessions.get(sessionId);
        if (s == null || !s.getStatus().isTerminal()) return false;
        sessions.remove(sessionId);
        return true;
    }

    public int activeCount() {
        return (int) sessions.values().stream().filter(Session::isInProgress).count();
    }

    public int size() {
        return sessions.size();
    }
}
