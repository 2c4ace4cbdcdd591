package com.supportdesk.trigger.listener;

import com.supportdesk.domain.ticket.model.valobj.SlaBreachedEvent;
import com.supportdesk.types.common.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * SLA 违约通知的进程内消费者，写入审计日志供运营侧采集。
 */
@Component
public class SlaBreachAuditListener {

    private static final Logger AUDIT = LoggerFactory.getLogger(Constants.AUDIT_LOGGER);

    @EventListener
    public void onSlaBreached(SlaBreachedEvent event) {
        AUDIT.warn("SLA_BREACHED ticketId={}, conversationId={}, departmentId={}, assignedAgentId={}, priority={}, escalationLevel={}, slaDueAt={}, occurredAt={}",
                event.ticketId(),
                event.conversationId(),
                event.departmentId(),
                event.assignedAgentId(),
                event.priority(),
                event.escalationLevel(),
                event.slaDueAt(),
                event.occurredAt());
    }
}
