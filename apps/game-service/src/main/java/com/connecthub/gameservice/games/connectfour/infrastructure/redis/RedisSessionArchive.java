package com.connecthub.gameservice.games.connectfour.infrastructure.redis;

import com.connecthub.gameservice.games.connectfour.domain.model.FinalizedSession;
import com.connecthub.gameservice.games.connectfour.domain.repository.SessionArchive;
import com.connecthub.gameservice.infrastructure.redis.RedisOps;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * 对局归档的 Redis 实现。
 * SETNX 保证同一对局最多写入一次；Redis 不可达时熔断兜底，只记日志。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisSessionArchive implements SessionArchive {

    static final Duration ARCHIVE_TTL = Duration.ofDays(30);

    private final RedisOps redisOps;

    @Override
    @CircuitBreaker(name = "sessionArchive", fallbackMethod = "persistFallback")
    public boolean persist(FinalizedSession session) {
        boolean written = redisOps.setNx(RedisKeys.archivedSession(session.getSessionId()), session, ARCHIVE_TTL);
        if (written) {
            log.info("对局已归档: sessionId={}, status={}, winner={}, moves={}",
                    session.getSessionId(), session.getStatus(), session.getWinnerId(), session.getMoves().size());
        } else {
            log.warn("对局已归档过，忽略重复写入: sessionId={}", session.getSessionId());
        }
        return written;
    }

    @Override
    @CircuitBreaker(name = "sessionArchive", fallbackMethod = "findFallback")
    public Optional<FinalizedSession> find(String sessionId) {
        return Optional.ofNullable(redisOps.get(RedisKeys.archivedSession(sessionId), FinalizedSession.class));
    }

    boolean persistFallback(FinalizedSession session, Throwable ex) {
        log.warn("归档对局失败，已跳过: sessionId={}, ex={}", session.getSessionId(), ex.toString());
        return false;
    }

    Optional<FinalizedSession> findFallback(String sessionId, Throwable ex) {
        log.warn("读取归档失败: sessionId={}, ex={}", sessionId, ex.toString());
        return Optional.empty();
    }
}
