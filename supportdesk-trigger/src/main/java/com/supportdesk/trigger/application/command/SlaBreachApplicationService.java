package com.supportdesk.trigger.application.command;

import com.supportdesk.domain.ticket.adapter.gateway.ITicketNotificationGateway;
import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.domain.ticket.model.valobj.NotifyResult;
import com.supportdesk.domain.ticket.service.TicketTransitionDomainService;
import com.supportdesk.types.common.Constants;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * SLA 违约处理用例：标记违约、上调优先级、写 ESCALATED 事件，提交后再发通知。
 * <p>
 * 违约标记是粘性的，扫描只会选出尚未标记的工单，因此同一次违约只升级、通知一次。
 * </p>
 */
@Slf4j
@Service
public class SlaBreachApplicationService {

    private static final Logger AUDIT = LoggerFactory.getLogger(Constants.AUDIT_LOGGER);

    private final ITicketRepository ticketRepository;
    private final ITicketEventRepository ticketEventRepository;
    private final ITicketNotificationGateway notificationGateway;
    private final TicketTransitionDomainService ticketTransitionDomainService;
    private final TransactionOperations transactionOperations;
    private final Counter breachCounter;
    private final Counter notifyFailureCounter;
    private final Counter failureCounter;

    public SlaBreachApplicationService(ITicketRepository ticketRepository,
                                       ITicketEventRepository ticketEventRepository,
                                       ITicketNotificationGateway notificationGateway,
                                       TicketTransitionDomainService ticketTransitionDomainService,
                                       TransactionOperations transactionOperations) {
        this.ticketRepository = ticketRepository;
        this.ticketEventRepository = ticketEventRepository;
        this.notificationGateway = notificationGateway;
        this.ticketTransitionDomainService = ticketTransitionDomainService;
        this.transactionOperations = transactionOperations;
        this.breachCounter = Counter.builder("supportdesk.sla.breach.total").register(Metrics.globalRegistry);
        this.notifyFailureCounter = Counter.builder("supportdesk.sla.notify.failure.total").register(Metrics.globalRegistry);
        this.failureCounter = Counter.builder("supportdesk.sla.breach.failure.total").register(Metrics.globalRegistry);
    }

    /**
     * 扫描并处理所有违约工单，按 batchSize 分页直到没有新的候选。
     * 本轮未能升级的工单（冲突、失败、已不满足条件）记下并在后续分页中跳过，
     * 查询上限随之放大，保证排在前面的问题工单不会挡住后面的违约工单。
     */
    public SweepResult sweep(LocalDateTime now, int batchSize) {
        int pageSize = batchSize > 0 ? batchSize : 200;
        int scanned = 0;
        int escalated = 0;
        int skipped = 0;
        int notifyFailed = 0;
        int failed = 0;
        Set<Long> unresolved = new HashSet<>();
        while (true) {
            int limit = pageSize + unresolved.size();
            List<TicketEntity> candidates = ticketRepository.findSlaBreachCandidates(now, limit);
            if (candidates == null || candidates.isEmpty()) {
                break;
            }
            int fresh = 0;
            for (TicketEntity candidate : candidates) {
                if (unresolved.contains(candidate.getId())) {
                    continue;
                }
                fresh++;
                scanned++;
                BreachOutcome outcome = handleBreach(candidate.getId(), now);
                switch (outcome) {
                    case ESCALATED:
                        escalated++;
                        break;
                    case ESCALATED_NOTIFY_FAILED:
                        escalated++;
                        notifyFailed++;
                        break;
                    case FAILED:
                        failed++;
                        unresolved.add(candidate.getId());
                        break;
                    default:
                        skipped++;
                        unresolved.add(candidate.getId());
                        break;
                }
            }
            if (fresh == 0 || candidates.size() < limit) {
                break;
            }
        }
        if (scanned > 0) {
            log.info("SLA sweep finished. now={}, scanned={}, escalated={}, skipped={}, notifyFailed={}, failed={}",
                    now, scanned, escalated, skipped, notifyFailed, failed);
        }
        return new SweepResult(scanned, escalated, skipped, notifyFailed, failed);
    }

    /**
     * 处理单个工单的违约。事务内重新加载并校验条件，已被其他实例处理时跳过。
     */
    public BreachOutcome handleBreach(Long ticketId, LocalDateTime now) {
        TicketEntity escalatedTicket;
        try {
            escalatedTicket = transactionOperations.execute(status -> {
                TicketEntity ticket = ticketRepository.findById(ticketId);
                TicketEventEntity event = ticketTransitionDomainService.escalateOnBreach(ticket, now);
                if (event == null) {
                    return null;
                }
                ticketRepository.update(ticket);
                ticketEventRepository.save(event);
                return ticket;
            });
        } catch (ConcurrencyFailureException ex) {
            log.warn("SLA breach skipped on concurrent update. ticketId={}, error={}", ticketId, ex.getMessage());
            return BreachOutcome.CONFLICT;
        } catch (RuntimeException ex) {
            failureCounter.increment();
            log.error("SLA breach handling failed. ticketId={}, errorType={}, error={}",
                    ticketId, ex.getClass().getSimpleName(), ex.getMessage(), ex);
            return BreachOutcome.FAILED;
        }
        if (escalatedTicket == null) {
            return BreachOutcome.NOT_ELIGIBLE;
        }
        breachCounter.increment();
        AUDIT.info("SLA_BREACHED ticketId={}, conversationId={}, priority={}, escalationLevel={}, slaDueAt={}",
                escalatedTicket.getId(), escalatedTicket.getConversationId(), escalatedTicket.getPriority(),
                escalatedTicket.getEscalationLevel(), escalatedTicket.getSlaDueAt());

        NotifyResult notifyResult = notificationGateway.notifySlaBreach(escalatedTicket);
        if (notifyResult == null || !notifyResult.delivered()) {
            notifyFailureCounter.increment();
            log.warn("SLA breach notification not delivered. ticketId={}, channel={}, error={}",
                    ticketId,
                    notifyResult == null ? null : notifyResult.channel(),
                    notifyResult == null ? "no result" : notifyResult.errorMessage());
            return BreachOutcome.ESCALATED_NOTIFY_FAILED;
        }
        return BreachOutcome.ESCALATED;
    }

    public enum BreachOutcome {
        ESCALATED,
        ESCALATED_NOTIFY_FAILED,
        NOT_ELIGIBLE,
        CONFLICT,
        FAILED
    }

    public record SweepResult(int scanned, int escalated, int skipped, int notifyFailed, int failed) {
        public static SweepResult empty() {
            return new SweepResult(0, 0, 0, 0, 0);
        }
    }
}
