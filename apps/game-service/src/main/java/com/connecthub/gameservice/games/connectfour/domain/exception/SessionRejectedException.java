package com.connecthub.gameservice.games.connectfour.domain.exception;

import com.connecthub.gameservice.games.connectfour.domain.enums.RejectCode;
import lombok.Getter;

/**
 * 对局意图被拒绝。抛出前不会对任何状态做修改。
 */
@Getter
public class SessionRejectedException extends RuntimeException {

    private final RejectCode code;
    private final String sessionId;

    public SessionRejectedException(RejectCode code, String sessionId, String message) {
        super(message);
        this.code = code;
        this.sessionId = sessionId;
    }
}
