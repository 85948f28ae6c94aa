package com.connecthub.gameservice.games.connectfour.application;

import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent;

/**
 * 对局生命周期事件出口（发后即忘，失败由实现吞掉并记录日志）。
 */
public interface LifecycleEventSink {

    void publish(GameLifecycleEvent event);
}
