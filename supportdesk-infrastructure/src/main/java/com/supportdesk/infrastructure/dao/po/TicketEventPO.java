package com.supportdesk.infrastructure.dao.po;

import com.supportdesk.types.enums.TicketEventTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工单事件 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketEventPO {

    private Long id;

    /**
     * 工单 ID (关联 tickets.id)
     */
    private Long ticketId;

    private TicketEventTypeEnum eventType;

    private String oldValue;

    private String newValue;

    /**
     * 附加信息 (JSONB)
     */
    private String detail;

    private LocalDateTime createdAt;
}
