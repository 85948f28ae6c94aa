package com.connecthub.gameservice.games.connectfour.infrastructure.analytics;

/**
 * 对局统计概览。
 *
 * @param totalGames          开局数
 * @param completedGames      结束局数（含弃局）
 * @param averageGameDuration 平均对局时长（分钟），只统计开始与结束都在缓冲区内的对局
 * @param eventsToday         今日事件数
 * @param mostActiveHour      事件最多的小时（0~23），无事件时为 0
 */
public record AnalyticsSummary(long totalGames, long completedGames, double averageGameDuration,
                               long eventsToday, int mostActiveHour) {
}
