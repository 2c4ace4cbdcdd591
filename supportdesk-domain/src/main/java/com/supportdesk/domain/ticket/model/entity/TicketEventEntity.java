package com.supportdesk.domain.ticket.model.entity;

import com.supportdesk.types.enums.TicketEventTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 工单事件（只追加的审计记录）
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Data
public class TicketEventEntity {

    private Long id;

    private Long ticketId;

    private TicketEventTypeEnum eventType;

    private String oldValue;

    private String newValue;

    /**
     * 附加信息
     */
    private Map<String, Object> detail;

    private LocalDateTime createdAt;

    public static TicketEventEntity of(Long ticketId,
                                       TicketEventTypeEnum eventType,
                                       Object oldValue,
                                       Object newValue,
                                       Map<String, Object> detail,
                                       LocalDateTime now) {
        TicketEventEntity event = new TicketEventEntity();
        event.setTicketId(ticketId);
        event.setEventType(eventType);
        event.setOldValue(oldValue == null ? null : String.valueOf(oldValue));
        event.setNewValue(newValue == null ? null : String.valueOf(newValue));
        event.setDetail(detail);
        event.setCreatedAt(now);
        return event;
    }

    public void validate() {
        if (ticketId == null) {
            throw new IllegalStateException("Ticket ID cannot be null");
        }
        if (eventType == null) {
            throw new IllegalStateException("Event type cannot be null");
        }
    }
}
