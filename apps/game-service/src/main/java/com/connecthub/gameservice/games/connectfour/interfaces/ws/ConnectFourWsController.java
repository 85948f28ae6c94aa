package com.connecthub.gameservice.games.connectfour.interfaces.ws;

import com.connecthub.gameservice.games.connectfour.application.SessionNotifier;
import com.connecthub.gameservice.games.connectfour.domain.constants.GameMessages;
import com.connecthub.gameservice.games.connectfour.domain.enums.RejectCode;
import com.connecthub.gameservice.games.connectfour.domain.exception.SessionRejectedException;
import com.connecthub.gameservice.games.connectfour.interfaces.ws.dto.ConnectFourMessages.JoinCmd;
import com.connecthub.gameservice.games.connectfour.interfaces.ws.dto.ConnectFourMessages.MoveCmd;
import com.connecthub.gameservice.games.connectfour.interfaces.ws.dto.ConnectFourMessages.RejoinCmd;
import com.connecthub.gameservice.games.connectfour.service.SessionLifecycleService;
import com.connecthub.gameservice.platform.loop.SessionEventLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * 四子棋 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/connect4.* 指令，切到会话事件循环后交给生命周期服务；
 * 被拒绝的指令以 MOVE_REJECTED 推回给发起连接。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ConnectFourWsController {

    private final SessionLifecycleService lifecycleService;
    private final SessionEventLoop eventLoop;
    private final SessionNotifier notifier;

    /** 加入匹配：/app/connect4.join */
    @MessageMapping("/connect4.join")
    public void join(JoinCmd cmd, SimpMessageHeaderAccessor sha) {
        final String conn = sha.getSessionId();
        eventLoop.execute("join-queue", () -> guarded(conn, null,
                () -> lifecycleService.joinQueue(cmd.getHandle(), conn)));
    }

    /** 落子：/app/connect4.move */
    @MessageMapping("/connect4.move")
    public void move(MoveCmd cmd, SimpMessageHeaderAccessor sha) {
        final String conn = sha.getSessionId();
        if (cmd.getColumn() == null) {
            notifier.moveRejected(conn, cmd.getSessionId(), RejectCode.BAD_REQUEST, GameMessages.COLUMN_REQUIRED);
            return;
        }
        final int column = cmd.getColumn();
        eventLoop.execute("submit-move", () -> guarded(conn, cmd.getSessionId(),
                () -> lifecycleService.submitMove(cmd.getSessionId(), conn, column)));
    }

    /** 重连：/app/connect4.rejoin */
    @MessageMapping("/connect4.rejoin")
    public void rejoin(RejoinCmd cmd, SimpMessageHeaderAccessor sha) {
        final String conn = sha.getSessionId();
        eventLoop.execute("rejoin", () -> guarded(conn, cmd.getSessionId(),
                () -> lifecycleService.rejoin(cmd.getSessionId(), cmd.getHandle(), conn)));
    }

    private void guarded(String conn, String sessionId, Runnable action) {
        try {
            action.run();
        } catch (SessionRejectedException e) {
            log.debug("指令被拒绝: conn={}, sessionId={}, code={}, msg={}", conn, sessionId, e.getCode(), e.getMessage());
            notifier.moveRejected(conn, e.getSessionId() != null ? e.getSessionId() : sessionId, e.getCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            notifier.moveRejected(conn, sessionId, RejectCode.BAD_REQUEST, e.getMessage());
        }
    }
}
