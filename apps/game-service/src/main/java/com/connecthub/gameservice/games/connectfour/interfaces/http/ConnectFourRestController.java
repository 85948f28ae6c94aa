package com.connecthub.gameservice.games.connectfour.interfaces.http;

import com.connecthub.gameservice.games.connectfour.application.player.LeaderboardEntry;
import com.connecthub.gameservice.games.connectfour.application.player.PlayerDirectoryService;
import com.connecthub.gameservice.games.connectfour.domain.constants.GameMessages;
import com.connecthub.gameservice.games.connectfour.domain.enums.RejectCode;
import com.connecthub.gameservice.games.connectfour.domain.exception.SessionRejectedException;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionSnapshot;
import com.connecthub.gameservice.games.connectfour.infrastructure.analytics.AnalyticsEventSink;
import com.connecthub.gameservice.games.connectfour.infrastructure.analytics.AnalyticsSummary;
import com.connecthub.gameservice.games.connectfour.service.SessionLifecycleService;
import com.connecthub.gameservice.platform.loop.SessionEventLoop;
import com.connecthub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 四子棋只读 REST 接口：对局快照、排行榜、统计概览。
 */
@RestController
@RequestMapping("/api/connect4")
@RequiredArgsConstructor
public class ConnectFourRestController {

    private final SessionLifecycleService lifecycleService;
    private final SessionEventLoop eventLoop;
    private final PlayerDirectoryService playerDirectory;
    private final AnalyticsEventSink analytics;

    /** 进行中或刚结束的对局快照 */
    @GetMapping("/sessions/{sessionId}")
    public ApiResponse<SessionSnapshot> session(@PathVariable String sessionId) {
        SessionSnapshot snap = eventLoop.call(() -> lifecycleService.snapshot(sessionId))
                .orElseThrow(() -> new SessionRejectedException(RejectCode.NOT_FOUND, sessionId,
                        GameMessages.formatNotFound(sessionId)));
        return ApiResponse.success(snap);
    }

    @GetMapping("/leaderboard")
    public ApiResponse<List<LeaderboardEntry>> leaderboard(
            @RequestParam(defaultValue = "" + PlayerDirectoryService.DEFAULT_LEADERBOARD_LIMIT) int limit) {
        return ApiResponse.success(playerDirectory.leaderboard(Math.min(limit, 100)));
    }

    @GetMapping("/analytics")
    public ApiResponse<AnalyticsSummary> analytics() {
        return ApiResponse.success(analytics.summary());
    }
}
