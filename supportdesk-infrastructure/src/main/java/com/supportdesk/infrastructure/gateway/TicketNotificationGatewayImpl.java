package com.supportdesk.infrastructure.gateway;

import com.supportdesk.domain.ticket.adapter.gateway.ITicketNotificationGateway;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.valobj.NotifyResult;
import com.supportdesk.domain.ticket.model.valobj.SlaBreachedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 工单通知网关：记录告警日志并发布进程内事件，具体投递渠道由监听方决定。
 */
@Slf4j
@Component
public class TicketNotificationGatewayImpl implements ITicketNotificationGateway {

    static final String CHANNEL = "application-event";

    private final ApplicationEventPublisher eventPublisher;

    public TicketNotificationGatewayImpl(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public NotifyResult notifySlaBreach(TicketEntity ticket) {
        if (ticket == null || ticket.getId() == null) {
            return NotifyResult.failed(CHANNEL, "ticket is empty");
        }
        try {
            log.warn("SLA breached. ticketId={}, conversationId={}, departmentId={}, priority={}, slaDueAt={}",
                    ticket.getId(),
                    ticket.getConversationId(),
                    ticket.getDepartmentId(),
                    ticket.getPriority(),
                    ticket.getSlaDueAt());
            eventPublisher.publishEvent(new SlaBreachedEvent(
                    ticket.getId(),
                    ticket.getConversationId(),
                    ticket.getDepartmentId(),
                    ticket.getAssignedAgentId(),
                    ticket.getPriority(),
                    ticket.escalationLevelValue(),
                    ticket.getSlaDueAt(),
                    LocalDateTime.now()
            ));
            return NotifyResult.delivered(CHANNEL);
        } catch (RuntimeException ex) {
            log.error("SLA breach notification failed. ticketId={}, error={}", ticket.getId(), ex.getMessage(), ex);
            return NotifyResult.failed(CHANNEL, ex.getMessage());
        }
    }
}
