package com.supportdesk.types.enums;

/**
 * 工单状态枚举
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public enum TicketStatusEnum {

    /**
     * 待处理 - 升级后新建，等待坐席响应
     */
    OPEN("OPEN"),

    /**
     * 处理中 - 坐席已开始处理
     */
    IN_PROGRESS("IN_PROGRESS"),

    /**
     * 已解决 - 坐席给出解决方案，可被重新打开
     */
    RESOLVED("RESOLVED"),

    /**
     * 已关闭 - 终态
     */
    CLOSED("CLOSED");

    private final String code;

    TicketStatusEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }

    public static TicketStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TicketStatusEnum status : TicketStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ticket status code: " + code);
    }
}
