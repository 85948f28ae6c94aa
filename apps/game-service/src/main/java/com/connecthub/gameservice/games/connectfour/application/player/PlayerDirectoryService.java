package com.connecthub.gameservice.games.connectfour.application.player;

import com.connecthub.gameservice.games.connectfour.infrastructure.redis.RedisKeys;
import com.connecthub.gameservice.infrastructure.redis.RedisOps;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 玩家目录：昵称 → 稳定玩家 ID，以及胜负计数与排行榜。
 * <p>
 * 昵称只是尽力而为的身份标识，不做任何认证。
 * Redis 不可用时熔断，退化为进程内存，保证匹配与对局不受影响。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerDirectoryService {

    public static final int DEFAULT_LEADERBOARD_LIMIT = 10;

    private final RedisOps redisOps;

    /** Redis 不可用时的兜底存储：id → 档案 */
    private final Map<String, PlayerProfile> memoryProfiles = new ConcurrentHashMap<>();
    /** 兜底：昵称 → id */
    private final Map<String, String> memoryHandles = new ConcurrentHashMap<>();

    /**
     * 按昵称取玩家档案，不存在则创建。
     */
    @CircuitBreaker(name = "playerDirectory", fallbackMethod = "createOrGetFallback")
    public PlayerProfile createOrGet(String handle) {
        String candidate = newPlayerId();
        redisOps.hSetNx(RedisKeys.handleIndex(), handle, candidate);
        String id = redisOps.hGet(RedisKeys.handleIndex(), handle, String.class);
        if (id == null) {
            throw new IllegalStateException("handle index unreadable for " + handle);
        }
        String key = RedisKeys.player(id);
        if (id.equals(candidate)) {
            redisOps.hSet(key, "handle", handle);
            redisOps.hSet(key, "gamesWon", 0);
            redisOps.hSet(key, "gamesLost", 0);
            log.info("新玩家登记: handle={}, id={}", handle, id);
        }
        return readProfile(id, redisOps.hGetAll(key), handle);
    }

    /**
     * 记一局胜/负，并刷新排行榜分数。
     */
    @CircuitBreaker(name = "playerDirectory", fallbackMethod = "recordResultFallback")
    public void recordResult(String participantId, String handle, boolean won) {
        String key = RedisKeys.player(participantId);
        redisOps.hSetNx(key, "handle", handle);
        redisOps.hIncrBy(key, won ? "gamesWon" : "gamesLost", 1);
        PlayerProfile p = readProfile(participantId, redisOps.hGetAll(key), handle);
        redisOps.zAdd(RedisKeys.leaderboard(), participantId, rankScore(p));
        log.info("战绩已更新: id={}, won={}, record={}-{}", participantId, won, p.gamesWon(), p.gamesLost());
    }

    /**
     * 排行榜：胜场优先，其次胜率。
     */
    @CircuitBreaker(name = "playerDirectory", fallbackMethod = "leaderboardFallback")
    public List<LeaderboardEntry> leaderboard(int limit) {
        int n = limit <= 0 ? DEFAULT_LEADERBOARD_LIMIT : limit;
        List<PlayerProfile> profiles = new ArrayList<>();
        for (String id : redisOps.zRevRange(RedisKeys.leaderboard(), n)) {
            profiles.add(readProfile(id, redisOps.hGetAll(RedisKeys.player(id)), null));
        }
        return rank(profiles, n);
    }

    PlayerProfile createOrGetFallback(String handle, Throwable ex) {
        log.warn("玩家目录不可用，使用内存兜底: handle={}, ex={}", handle, ex.toString());
        String id = memoryHandles.computeIfAbsent(handle, h -> newPlayerId());
        return memoryProfiles.computeIfAbsent(id, i -> new PlayerProfile(i, handle, 0, 0));
    }

    void recordResultFallback(String participantId, String handle, boolean won, Throwable ex) {
        log.warn("写入战绩失败，记入内存: id={}, won={}, ex={}", participantId, won, ex.toString());
        memoryProfiles.compute(participantId, (id, old) -> {
            PlayerProfile base = old == null ? new PlayerProfile(id, handle, 0, 0) : old;
            return new PlayerProfile(id, base.handle(),
                    base.gamesWon() + (won ? 1 : 0), base.gamesLost() + (won ? 0 : 1));
        });
    }

    List<LeaderboardEntry> leaderboardFallback(int limit, Throwable ex) {
        log.warn("读取排行榜失败，使用内存数据: ex={}", ex.toString());
        int n = limit <= 0 ? DEFAULT_LEADERBOARD_LIMIT : limit;
        return rank(new ArrayList<>(memoryProfiles.values()), n);
    }

    static List<LeaderboardEntry> rank(List<PlayerProfile> profiles, int limit) {
        return profiles.stream()
                .filter(p -> p.totalGames() > 0)
                .sorted(Comparator.comparingInt(PlayerProfile::gamesWon).reversed()
                        .thenComparing(Comparator.comparingDouble(PlayerProfile::winRatio).reversed()))
                .limit(limit)
                .map(LeaderboardEntry::of)
                .toList();
    }

    /** 排行榜分数：整数部分为胜场，小数部分为胜率（0~100 映射到 0~0.1） */
    static double rankScore(PlayerProfile p) {
        return p.gamesWon() + p.winRatio() / 1000.0;
    }

    private static PlayerProfile readProfile(String id, Map<String, Object> hash, String handleHint) {
        Object handle = hash.get("handle");
        return new PlayerProfile(id,
                handle == null ? handleHint : String.valueOf(handle),
                toInt(hash.get("gamesWon")),
                toInt(hash.get("gamesLost")));
    }

    private static int toInt(Object v) {
        if (v instanceof Number n) return n.intValue();
        if (v == null) return 0;
        try {
            return Integer.parseInt(String.valueOf(v));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String newPlayerId() {
        return "p_" + UUID.randomUUID().toString().replace("-", "");
    }
}
