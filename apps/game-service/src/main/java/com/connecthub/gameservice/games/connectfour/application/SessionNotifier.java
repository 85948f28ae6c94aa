package com.connecthub.gameservice.games.connectfour.application;

import com.connecthub.gameservice.games.connectfour.domain.enums.EndReason;
import com.connecthub.gameservice.games.connectfour.domain.enums.RejectCode;
import com.connecthub.gameservice.games.connectfour.domain.model.Move;
import com.connecthub.gameservice.games.connectfour.domain.model.Outcome;
import com.connecthub.gameservice.games.connectfour.domain.model.SessionSnapshot;

/**
 * 向单个连接推送对局通知。实现不得抛出异常。
 */
public interface SessionNotifier {

    void queued(String connectionHandle, long timeoutSeconds);

    void sessionStarted(String connectionHandle, SessionSnapshot snapshot, String yourId, String opponentId,
                        boolean vsAi);

    void sessionRejoined(String connectionHandle, SessionSnapshot snapshot, String yourId, String opponentId);

    void moveApplied(String connectionHandle, SessionSnapshot snapshot, Move move, String nextTurn);

    void sessionEnded(String connectionHandle, SessionSnapshot snapshot, Outcome outcome, EndReason reason);

    void opponentDisconnected(String connectionHandle, String sessionId, String participantId, long timeoutSeconds);

    void opponentReconnected(String connectionHandle, String sessionId, String participantId);

    void moveRejected(String connectionHandle, String sessionId, RejectCode code, String message);
}
