package com.supportdesk.domain.ticket.service;

import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.types.common.Constants;
import com.supportdesk.types.enums.TicketEventTypeEnum;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 工单状态流转领域服务：负责复用合并、违约升级与人工流转，并产出对应审计事件。
 * 仓储写入由应用层在同一事务中完成。
 */
@Service
public class TicketTransitionDomainService {

    /**
     * 合并升级原因，按出现顺序去重。
     */
    public String mergeReason(String existing, String incoming) {
        Set<String> parts = new LinkedHashSet<>();
        collectReasonParts(parts, existing);
        collectReasonParts(parts, incoming);
        return parts.isEmpty() ? null : String.join(Constants.REASON_SEPARATOR, parts);
    }

    /**
     * 复用 OPEN 工单，返回 REUSED 事件。
     */
    public TicketEventEntity reuse(TicketEntity ticket,
                                   TicketPriorityEnum priority,
                                   String reason,
                                   Long messageId,
                                   LocalDateTime now) {
        TicketPriorityEnum before = ticket.getPriority();
        ticket.absorbEscalation(priority, mergeReason(ticket.getReason(), reason), messageId, now);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("messageId", messageId);
        detail.put("reason", reason);
        return TicketEventEntity.of(ticket.getId(), TicketEventTypeEnum.REUSED,
                codeOf(before), codeOf(ticket.getPriority()), detail, now);
    }

    /**
     * 违约升级。不满足条件时返回 null，保证同一次违约只升级一次。
     */
    public TicketEventEntity escalateOnBreach(TicketEntity ticket, LocalDateTime now) {
        if (ticket == null) {
            return null;
        }
        TicketPriorityEnum before = ticket.getPriority();
        int levelBefore = ticket.escalationLevelValue();
        if (!ticket.markSlaBreached(now)) {
            return null;
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("trigger", "SLA_BREACH");
        detail.put("slaDueAt", String.valueOf(ticket.getSlaDueAt()));
        detail.put("escalationLevelBefore", levelBefore);
        detail.put("escalationLevelAfter", ticket.escalationLevelValue());
        return TicketEventEntity.of(ticket.getId(), TicketEventTypeEnum.ESCALATED,
                codeOf(before), codeOf(ticket.getPriority()), detail, now);
    }

    /**
     * 人工流转，非法流转抛出 IllegalStateException。
     */
    public TicketEventEntity transit(TicketEntity ticket, TicketStatusEnum target, LocalDateTime now) {
        TicketStatusEnum before = ticket.getStatus();
        ticket.transitTo(target, now);
        return TicketEventEntity.of(ticket.getId(), TicketEventTypeEnum.STATUS_CHANGED,
                before == null ? null : before.getCode(), target.getCode(), null, now);
    }

    private void collectReasonParts(Set<String> parts, String reason) {
        if (StringUtils.isBlank(reason)) {
            return;
        }
        for (String part : StringUtils.splitByWholeSeparator(reason, Constants.REASON_SEPARATOR)) {
            if (StringUtils.isNotBlank(part)) {
                parts.add(part.trim());
            }
        }
    }

    private String codeOf(TicketPriorityEnum priority) {
        return priority == null ? null : priority.getCode();
    }
}
