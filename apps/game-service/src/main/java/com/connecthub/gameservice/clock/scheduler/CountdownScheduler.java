package com.connecthub.gameservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 一次性倒计时调度器，与具体业务无关。
 *
 * 约定：
 *  - 倒计时不提供取消：到期回调一定会执行，由上层凭 version 自行判断是否仍然有效；
 *  - 同一 key 可以同时挂多个不同 version 的倒计时，互不覆盖。
 */
public interface CountdownScheduler {

    /**
     * 到期回调。
     */
    interface TimeoutHandler {
        /**
         * @param key     业务键（如 "abandon:{sessionId}:{participantId}"）
         * @param owner   被计时的一方
         * @param version 启动倒计时时的版本（上层用于幂等校验）
         */
        void onTimeout(String key, String owner, String version);
    }

    /**
     * 启动倒计时；截止时间已过则尽快触发。
     * @param key             业务键
     * @param owner           被计时的一方
     * @param deadlineEpochMs 绝对截止时间（毫秒）
     * @param version         版本
     * @param onTimeout       到期回调
     */
    void start(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout);

    /** 尚未触发的倒计时数量 */
    int pendingCount();
}
