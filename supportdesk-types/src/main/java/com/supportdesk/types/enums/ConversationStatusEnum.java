package com.supportdesk.types.enums;

/**
 * 会话状态枚举
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public enum ConversationStatusEnum {

    OPEN,
    CLOSED,

    /**
     * 已升级至人工 - 首次创建工单时标记
     */
    ESCALATED
}
