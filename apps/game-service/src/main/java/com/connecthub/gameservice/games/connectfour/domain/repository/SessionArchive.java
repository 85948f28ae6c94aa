package com.connecthub.gameservice.games.connectfour.domain.repository;

import com.connecthub.gameservice.games.connectfour.domain.model.FinalizedSession;

import java.util.Optional;

/**
 * 已结束对局的归档存储（只追加）。
 */
public interface SessionArchive {

    /**
     * 归档一局已结束的对局。
     * 同一对局只会写入一次，重复调用返回 false；存储不可达时记录日志并返回 false，不抛异常。
     */
    boolean persist(FinalizedSession session);

    /** 读取归档 */
    Optional<FinalizedSession> find(String sessionId);
}
