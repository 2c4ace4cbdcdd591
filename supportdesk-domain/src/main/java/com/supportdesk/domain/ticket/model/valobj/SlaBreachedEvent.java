package com.supportdesk.domain.ticket.model.valobj;

import com.supportdesk.types.enums.TicketPriorityEnum;

import java.time.LocalDateTime;

/**
 * SLA 违约进程内事件，由通知网关发布。
 */
public record SlaBreachedEvent(Long ticketId,
                               Long conversationId,
                               Long departmentId,
                               Long assignedAgentId,
                               TicketPriorityEnum priority,
                               int escalationLevel,
                               LocalDateTime slaDueAt,
                               LocalDateTime occurredAt) {
}
