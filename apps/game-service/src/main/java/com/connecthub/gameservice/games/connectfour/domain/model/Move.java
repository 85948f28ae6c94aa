package com.connecthub.gameservice.games.connectfour.domain.model;

/**
 * 一步已落定的棋：序号从 1 开始，row 为重力落点。
 */
public record Move(int seq, String participantId, int column, int row, long timestamp) {
}
