package com.supportdesk.trigger.application.command;

import com.supportdesk.domain.assignment.model.entity.SupportAgentEntity;
import com.supportdesk.domain.routing.adapter.gateway.IDepartmentClassifier;
import com.supportdesk.domain.routing.adapter.repository.IDepartmentRepository;
import com.supportdesk.domain.routing.adapter.repository.IRoutingRuleRepository;
import com.supportdesk.domain.routing.model.entity.DepartmentEntity;
import com.supportdesk.domain.routing.model.valobj.DepartmentPrediction;
import com.supportdesk.domain.routing.model.valobj.RoutingDecision;
import com.supportdesk.domain.routing.service.DepartmentRoutingDomainService;
import com.supportdesk.domain.sla.model.valobj.SlaDeadline;
import com.supportdesk.domain.sla.service.SlaPolicyDomainService;
import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.types.common.Constants;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.enums.RoutingMethodEnum;
import com.supportdesk.types.enums.TicketEventTypeEnum;
import com.supportdesk.types.exception.AppException;
import com.supportdesk.types.exception.ConsistencyConflictException;
import com.supportdesk.types.exception.TransientDependencyException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 工单路由用例：AI 分类（带硬超时）-> 关键词兜底 -> SLA 截止时间 -> 坐席分配。
 * <p>
 * 分类器调用在独立线程池中执行，不持有数据库事务；超时或失败一律视为“无 AI 结果”，
 * 不影响后续关键词路由。路由字段、SLA、分配结果与对应事件在同一事务内提交。
 * </p>
 */
@Slf4j
@Service
public class TicketRoutingApplicationService {

    private static final Logger AUDIT = LoggerFactory.getLogger(Constants.AUDIT_LOGGER);

    private final IDepartmentClassifier departmentClassifier;
    private final IDepartmentRepository departmentRepository;
    private final IRoutingRuleRepository routingRuleRepository;
    private final ITicketRepository ticketRepository;
    private final ITicketEventRepository ticketEventRepository;
    private final DepartmentRoutingDomainService departmentRoutingDomainService;
    private final SlaPolicyDomainService slaPolicyDomainService;
    private final AgentAssignmentApplicationService agentAssignmentApplicationService;
    private final TransactionOperations transactionOperations;
    private final ExecutorService classifierExecutor;
    private final Clock clock;
    private final double confidenceThreshold;
    private final long timeoutMs;
    private final boolean aiEnabled;
    private final int maxRetries;
    private final Counter aiCounter;
    private final Counter fallbackCounter;
    private final Counter unroutedCounter;
    private final Counter classifierFailureCounter;

    public TicketRoutingApplicationService(IDepartmentClassifier departmentClassifier,
                                           IDepartmentRepository departmentRepository,
                                           IRoutingRuleRepository routingRuleRepository,
                                           ITicketRepository ticketRepository,
                                           ITicketEventRepository ticketEventRepository,
                                           DepartmentRoutingDomainService departmentRoutingDomainService,
                                           SlaPolicyDomainService slaPolicyDomainService,
                                           AgentAssignmentApplicationService agentAssignmentApplicationService,
                                           TransactionOperations transactionOperations,
                                           @Qualifier("classifierExecutor") ExecutorService classifierExecutor,
                                           Clock clock,
                                           @Value("${routing.ai.confidence-threshold:0.75}") double confidenceThreshold,
                                           @Value("${routing.ai.timeout-ms:3000}") long timeoutMs,
                                           @Value("${routing.ai.enabled:true}") boolean aiEnabled,
                                           @Value("${ticket.lock.max-retries:1}") int maxRetries) {
        this.departmentClassifier = departmentClassifier;
        this.departmentRepository = departmentRepository;
        this.routingRuleRepository = routingRuleRepository;
        this.ticketRepository = ticketRepository;
        this.ticketEventRepository = ticketEventRepository;
        this.departmentRoutingDomainService = departmentRoutingDomainService;
        this.slaPolicyDomainService = slaPolicyDomainService;
        this.agentAssignmentApplicationService = agentAssignmentApplicationService;
        this.transactionOperations = transactionOperations;
        this.classifierExecutor = classifierExecutor;
        this.clock = clock;
        this.confidenceThreshold = confidenceThreshold > 0 && confidenceThreshold <= 1 ? confidenceThreshold : 0.75D;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 3000L;
        this.aiEnabled = aiEnabled;
        this.maxRetries = maxRetries >= 0 ? maxRetries : 1;
        this.aiCounter = Counter.builder("supportdesk.routing.ai.total").register(Metrics.globalRegistry);
        this.fallbackCounter = Counter.builder("supportdesk.routing.fallback.total").register(Metrics.globalRegistry);
        this.unroutedCounter = Counter.builder("supportdesk.routing.unrouted.total").register(Metrics.globalRegistry);
        this.classifierFailureCounter = Counter.builder("supportdesk.routing.classifier.failure.total")
                .register(Metrics.globalRegistry);
    }

    public RoutingResult route(Long ticketId, String messageText) {
        TicketEntity ticket = ticketRepository.findById(ticketId);
        if (ticket == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Ticket not found: " + ticketId);
        }
        List<DepartmentEntity> departments = departmentRepository.findAll();
        DepartmentPrediction prediction = classify(ticketId, messageText, departments);
        RoutingDecision decision = departmentRoutingDomainService.decide(
                prediction, messageText, departments, routingRuleRepository.findAllOrdered(), confidenceThreshold);
        SupportAgentEntity agent = ticket.getAssignedAgentId() == null
                ? agentAssignmentApplicationService.selectAgent(decision.departmentId(), null)
                : null;

        RuntimeException lastConflict = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                RoutingResult result = transactionOperations.execute(status -> applyInTransaction(ticketId, decision, agent));
                countDecision(decision);
                AUDIT.info("TICKET_ROUTED ticketId={}, departmentId={}, routingMethod={}, aiPredicted={}, aiConfidence={}, priority={}, slaDueAt={}, agentId={}",
                        ticketId, decision.departmentId(), decision.routingMethod(), decision.aiPredictedDepartment(),
                        decision.aiConfidence(), result.ticket().getPriority(), result.ticket().getSlaDueAt(),
                        result.ticket().getAssignedAgentId());
                return result;
            } catch (ConcurrencyFailureException ex) {
                lastConflict = ex;
                log.warn("Ticket routing conflict. ticketId={}, attempt={}, error={}", ticketId, attempt + 1, ex.getMessage());
            }
        }
        throw new ConsistencyConflictException(ticket.getConversationId(),
                "Concurrent ticket write while routing ticket " + ticketId, lastConflict);
    }

    /**
     * SLA 按事务内重新读取的优先级解析，并发复用抬高的优先级会落到正确的策略行上。
     */
    private RoutingResult applyInTransaction(Long ticketId,
                                             RoutingDecision decision,
                                             SupportAgentEntity agent) {
        TicketEntity ticket = ticketRepository.findById(ticketId);
        if (ticket == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Ticket not found: " + ticketId);
        }
        SlaDeadline deadline = slaPolicyDomainService.resolve(
                decision.departmentId(), ticket.getPriority(), ticket.getCreatedAt());
        LocalDateTime now = LocalDateTime.now(clock);
        Long departmentBefore = ticket.getDepartmentId();
        ticket.applyRouting(decision.departmentId(), decision.routingMethod(),
                decision.aiConfidence(), decision.aiPredictedDepartment(), now);
        ticket.applyDeadlines(
                deadline == null ? null : deadline.firstResponseDueAt(),
                deadline == null ? null : deadline.resolutionDueAt(),
                now);
        List<TicketEventEntity> events = new ArrayList<>();
        events.add(TicketEventEntity.of(ticketId, TicketEventTypeEnum.ROUTED,
                departmentBefore, decision.departmentId(), routingDetail(decision, deadline), now));
        if (agent != null && ticket.getAssignedAgentId() == null) {
            ticket.assignTo(agent.getId(), now);
            events.add(TicketEventEntity.of(ticketId, TicketEventTypeEnum.ASSIGNED,
                    null, agent.getId(), null, now));
        }
        ticketRepository.update(ticket);
        for (TicketEventEntity event : events) {
            ticketEventRepository.save(event);
        }
        return new RoutingResult(ticket, decision, deadline);
    }

    /**
     * 调用分类器，超时/失败/被拒绝都降级为不可用结果，不向上抛出。
     */
    private DepartmentPrediction classify(Long ticketId, String messageText, List<DepartmentEntity> departments) {
        if (!aiEnabled) {
            return DepartmentPrediction.unavailable("classifier disabled");
        }
        List<String> names = new ArrayList<>();
        for (DepartmentEntity department : departments) {
            if (department != null && department.getName() != null) {
                names.add(department.getName());
            }
        }
        Future<DepartmentPrediction> future = null;
        try {
            future = classifierExecutor.submit(() -> departmentClassifier.classify(messageText, names));
            DepartmentPrediction prediction = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return prediction == null ? DepartmentPrediction.unavailable("empty prediction") : prediction;
        } catch (TimeoutException ex) {
            future.cancel(true);
            return classifierFailed(ticketId, "classifier timeout after " + timeoutMs + "ms");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return classifierFailed(ticketId, "classifier interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            String kind = cause instanceof TransientDependencyException ? "transient" : cause.getClass().getSimpleName();
            return classifierFailed(ticketId, kind + ": " + cause.getMessage());
        } catch (RejectedExecutionException ex) {
            return classifierFailed(ticketId, "classifier executor saturated");
        }
    }

    private DepartmentPrediction classifierFailed(Long ticketId, String reason) {
        classifierFailureCounter.increment();
        log.warn("Department classifier unavailable, fallback to keyword rules. ticketId={}, reason={}", ticketId, reason);
        return DepartmentPrediction.unavailable(reason);
    }

    private Map<String, Object> routingDetail(RoutingDecision decision, SlaDeadline deadline) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("routingMethod", decision.routingMethod() == null ? null : decision.routingMethod().name());
        detail.put("aiPredictedDepartment", decision.aiPredictedDepartment());
        detail.put("aiConfidence", decision.aiConfidence());
        detail.put("matchedRuleId", decision.matchedRuleId());
        detail.put("slaTracked", deadline != null);
        return detail;
    }

    private void countDecision(RoutingDecision decision) {
        if (Objects.equals(decision.routingMethod(), RoutingMethodEnum.AI)) {
            aiCounter.increment();
        } else if (Objects.equals(decision.routingMethod(), RoutingMethodEnum.FALLBACK)) {
            fallbackCounter.increment();
        } else {
            unroutedCounter.increment();
        }
    }

    public record RoutingResult(TicketEntity ticket, RoutingDecision decision, SlaDeadline deadline) {
    }
}
