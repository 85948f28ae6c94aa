package com.connecthub.gameservice.games.connectfour.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 匹配队列条目。ticket 每次新入队递增，超时回调凭 ticket 识别自己是否已过期。
 */
@Data
@AllArgsConstructor
public class QueueEntry {
    /** 排队者（含当前连接句柄与战绩） */
    private Participant participant;
    private long enqueuedAt;
    private long ticket;

    public String participantId() {
        return participant.getId();
    }

    public String connectionHandle() {
        return participant.getConnectionHandle();
    }
}
