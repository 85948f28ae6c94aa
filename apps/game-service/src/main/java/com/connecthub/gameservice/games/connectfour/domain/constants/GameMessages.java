package com.connecthub.gameservice.games.connectfour.domain.constants;

/**
 * 四子棋相关的用户可见提示
 * 统一管理，避免在业务代码里散落硬编码字符串
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 拒绝原因 ==========

    /** 对局不存在 */
    public static final String SESSION_NOT_FOUND = "对局不存在: %s";

    /** 对局已结束 */
    public static final String SESSION_NOT_ACTIVE = "对局已结束（当前状态 %s）";

    /** 非当前回合 */
    public static final String NOT_YOUR_TURN = "还没轮到你落子";

    /** 非法列 */
    public static final String ILLEGAL_COLUMN = "第 %d 列不能落子（越界或已满）";

    /** 已在对局中 */
    public static final String ALREADY_IN_SESSION = "你已在对局 %s 中，请使用重连";

    /** 重连身份不匹配 */
    public static final String NOT_A_PARTICIPANT = "%s 不是该对局的参与者";

    /** 昵称为空 */
    public static final String HANDLE_REQUIRED = "昵称不能为空";

    /** 缺少对局 ID */
    public static final String SESSION_ID_REQUIRED = "缺少对局 ID";

    /** 缺少列号 */
    public static final String COLUMN_REQUIRED = "缺少落子列号";

    /** 连接已在对局中 */
    public static final String CONNECTION_IN_SESSION = "当前连接已在对局 %s 中";

    /** 加入匹配失败 */
    public static final String JOIN_UNAVAILABLE = "匹配服务繁忙，请稍后重试";

    public static String formatNotFound(String sessionId) {
        return String.format(SESSION_NOT_FOUND, sessionId);
    }

    public static String formatNotActive(String status) {
        return String.format(SESSION_NOT_ACTIVE, status);
    }

    public static String formatIllegalColumn(int column) {
        return String.format(ILLEGAL_COLUMN, column);
    }

    public static String formatAlreadyInSession(String sessionId) {
        return String.format(ALREADY_IN_SESSION, sessionId);
    }

    public static String formatConnectionInSession(String sessionId) {
        return String.format(CONNECTION_IN_SESSION, sessionId);
    }

    public static String formatNotAParticipant(String handle) {
        return String.format(NOT_A_PARTICIPANT, handle);
    }
}
