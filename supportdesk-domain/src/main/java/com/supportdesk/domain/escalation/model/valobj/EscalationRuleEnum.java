package com.supportdesk.domain.escalation.model.valobj;

import com.supportdesk.types.enums.TicketPriorityEnum;

/**
 * 升级规则及其对应优先级，声明顺序即原因拼接顺序。
 */
public enum EscalationRuleEnum {

    STRONG_NEGATIVE(TicketPriorityEnum.HIGH),
    REPEATED_NEGATIVE(TicketPriorityEnum.MEDIUM),
    KEYWORD(TicketPriorityEnum.CRITICAL);

    private final TicketPriorityEnum priority;

    EscalationRuleEnum(TicketPriorityEnum priority) {
        this.priority = priority;
    }

    public TicketPriorityEnum getPriority() {
        return priority;
    }
}
