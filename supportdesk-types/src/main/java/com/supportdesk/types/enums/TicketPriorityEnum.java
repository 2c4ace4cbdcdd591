package com.supportdesk.types.enums;

/**
 * 工单优先级枚举，按严重程度递增排列。
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public enum TicketPriorityEnum {

    LOW("LOW", 1),
    MEDIUM("MEDIUM", 2),
    HIGH("HIGH", 3),
    CRITICAL("CRITICAL", 4);

    private final String code;
    private final int severity;

    TicketPriorityEnum(String code, int severity) {
        this.code = code;
        this.severity = severity;
    }

    public String getCode() {
        return code;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isHigherThan(TicketPriorityEnum other) {
        return other == null || this.severity > other.severity;
    }

    /**
     * 上调一级，CRITICAL 保持不变。
     */
    public TicketPriorityEnum escalate() {
        switch (this) {
            case LOW:
                return MEDIUM;
            case MEDIUM:
                return HIGH;
            default:
                return CRITICAL;
        }
    }

    /**
     * 取两者中更严重的一个，null 视为最低。
     */
    public static TicketPriorityEnum max(TicketPriorityEnum left, TicketPriorityEnum right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return right.isHigherThan(left) ? right : left;
    }

    public static TicketPriorityEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TicketPriorityEnum priority : TicketPriorityEnum.values()) {
            if (priority.code.equalsIgnoreCase(code.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown ticket priority code: " + code);
    }
}
