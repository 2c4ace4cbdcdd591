package com.supportdesk.types.enums;

/**
 * 工单审计事件类型（只追加，不修改）。
 */
public enum TicketEventTypeEnum {

    CREATED("TicketCreated"),
    REUSED("TicketReused"),
    ROUTED("TicketRouted"),
    ASSIGNED("TicketAssigned"),
    ESCALATED("TicketEscalated"),
    STATUS_CHANGED("TicketStatusChanged");

    private final String eventName;

    TicketEventTypeEnum(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
