package com.supportdesk.trigger.service;

import com.supportdesk.domain.conversation.adapter.repository.IMessageRepository;
import com.supportdesk.domain.conversation.model.entity.MessageEntity;
import com.supportdesk.domain.escalation.model.valobj.EscalationDecision;
import com.supportdesk.domain.escalation.model.valobj.EscalationPolicy;
import com.supportdesk.domain.escalation.service.EscalationEvaluationDomainService;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.trigger.application.command.TicketLifecycleApplicationService;
import com.supportdesk.trigger.application.command.TicketLifecycleApplicationService.LifecycleResult;
import com.supportdesk.trigger.application.command.TicketRoutingApplicationService;
import com.supportdesk.types.common.Constants;
import com.supportdesk.types.enums.TicketPriorityEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 消息升级编排：升级判定 -> 工单去重/新建 -> 路由。
 * <p>
 * 该流程挂在对话回复链路旁边，任何失败都以 {@link EscalationOutcome} 返回，不向调用方抛出，
 * 对话回复不受影响。
 * </p>
 */
@Slf4j
@Service
public class EscalationOrchestratorService {

    private static final Logger AUDIT = LoggerFactory.getLogger(Constants.AUDIT_LOGGER);

    private final IMessageRepository messageRepository;
    private final EscalationEvaluationDomainService escalationEvaluationDomainService;
    private final TicketLifecycleApplicationService ticketLifecycleApplicationService;
    private final TicketRoutingApplicationService ticketRoutingApplicationService;
    private final EscalationPolicy policy;

    public EscalationOrchestratorService(IMessageRepository messageRepository,
                                         EscalationEvaluationDomainService escalationEvaluationDomainService,
                                         TicketLifecycleApplicationService ticketLifecycleApplicationService,
                                         TicketRoutingApplicationService ticketRoutingApplicationService,
                                         @Value("${escalation.strong-negative-threshold:-0.6}") double strongNegativeThreshold,
                                         @Value("${escalation.moderate-negative-threshold:-0.4}") double moderateNegativeThreshold,
                                         @Value("${escalation.recent-message-count:3}") int recentMessageCount,
                                         @Value("${escalation.repeat-window-hours:3}") long repeatWindowHours,
                                         @Value("${escalation.keywords:}") String keywords) {
        this.messageRepository = messageRepository;
        this.escalationEvaluationDomainService = escalationEvaluationDomainService;
        this.ticketLifecycleApplicationService = ticketLifecycleApplicationService;
        this.ticketRoutingApplicationService = ticketRoutingApplicationService;
        this.policy = EscalationPolicy.builder()
                .strongNegativeThreshold(strongNegativeThreshold)
                .moderateNegativeThreshold(moderateNegativeThreshold)
                .recentMessageCount(recentMessageCount > 0 ? recentMessageCount : EscalationPolicy.DEFAULT_RECENT_MESSAGE_COUNT)
                .repeatWindow(Duration.ofHours(repeatWindowHours > 0 ? repeatWindowHours : 3))
                .keywords(parseKeywords(keywords))
                .build();
    }

    public EscalationOutcome process(Long conversationId, Long messageId) {
        MessageEntity message;
        EscalationDecision decision;
        try {
            message = messageRepository.findById(messageId);
            if (message == null || !Objects.equals(message.getConversationId(), conversationId)) {
                return EscalationOutcome.failed(null, "Message not found in conversation: " + messageId);
            }
            List<MessageEntity> recent = messageRepository.findRecentUpTo(
                    conversationId, messageId, policy.getRecentMessageCount());
            decision = escalationEvaluationDomainService.evaluate(message, recent, policy);
        } catch (RuntimeException ex) {
            log.error("Escalation evaluation failed. conversationId={}, messageId={}, error={}",
                    conversationId, messageId, ex.getMessage(), ex);
            return EscalationOutcome.failed(null, ex.getMessage());
        }
        AUDIT.info("ESCALATION_EVALUATED conversationId={}, messageId={}, escalate={}, priority={}, rules={}",
                conversationId, messageId, decision.escalate(), decision.priority(), decision.firedRules());
        if (!decision.escalate()) {
            return EscalationOutcome.notEscalated();
        }

        LifecycleResult lifecycle;
        try {
            lifecycle = ticketLifecycleApplicationService.evaluateAndEscalate(conversationId, messageId,
                    decision.priority(), decision.reason(), policy.getRepeatWindow());
        } catch (RuntimeException ex) {
            log.error("Ticket escalation failed. conversationId={}, messageId={}, priority={}, error={}",
                    conversationId, messageId, decision.priority(), ex.getMessage(), ex);
            return EscalationOutcome.failed(decision, ex.getMessage());
        }

        TicketEntity ticket = lifecycle.ticket();
        String routingError = null;
        if (lifecycle.created() || !ticket.isRouted()) {
            try {
                ticket = ticketRoutingApplicationService.route(ticket.getId(), message.safeContent()).ticket();
            } catch (RuntimeException ex) {
                routingError = "routing failed: " + ex.getMessage();
                log.error("Ticket routing failed, ticket stays unrouted. ticketId={}, error={}",
                        ticket.getId(), ex.getMessage(), ex);
            }
        }
        log.info("Conversation escalated. conversationId={}, messageId={}, ticketId={}, created={}, priority={}",
                conversationId, messageId, ticket.getId(), lifecycle.created(), ticket.getPriority());
        return EscalationOutcome.escalated(decision, ticket, lifecycle.created(), routingError);
    }

    public EscalationPolicy getPolicy() {
        return policy;
    }

    private List<String> parseKeywords(String keywords) {
        if (StringUtils.isBlank(keywords)) {
            return EscalationPolicy.DEFAULT_KEYWORDS;
        }
        List<String> parsed = new ArrayList<>();
        for (String keyword : keywords.split(Constants.SPLIT)) {
            if (StringUtils.isNotBlank(keyword)) {
                parsed.add(keyword.trim());
            }
        }
        return parsed.isEmpty() ? EscalationPolicy.DEFAULT_KEYWORDS : parsed;
    }

    public enum OutcomeStatus {
        NOT_ESCALATED,
        TICKET_CREATED,
        TICKET_REUSED,
        FAILED
    }

    public record EscalationOutcome(OutcomeStatus status,
                                    boolean escalated,
                                    boolean ticketCreated,
                                    TicketPriorityEnum priority,
                                    String reason,
                                    TicketEntity ticket,
                                    String errorMessage) {

        public static EscalationOutcome notEscalated() {
            return new EscalationOutcome(OutcomeStatus.NOT_ESCALATED, false, false, null, null, null, null);
        }

        public static EscalationOutcome escalated(EscalationDecision decision,
                                                  TicketEntity ticket,
                                                  boolean created,
                                                  String errorMessage) {
            return new EscalationOutcome(created ? OutcomeStatus.TICKET_CREATED : OutcomeStatus.TICKET_REUSED,
                    true, created, ticket.getPriority(), decision.reason(), ticket, errorMessage);
        }

        public static EscalationOutcome failed(EscalationDecision decision, String errorMessage) {
            boolean escalate = decision != null && decision.escalate();
            return new EscalationOutcome(OutcomeStatus.FAILED, escalate, false,
                    decision == null ? null : decision.priority(),
                    decision == null ? null : decision.reason(),
                    null, errorMessage);
        }
    }
}
