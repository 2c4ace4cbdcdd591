package com.supportdesk.test.support;

import com.supportdesk.domain.assignment.service.AgentAssignmentDomainService;
import com.supportdesk.domain.escalation.service.EscalationEvaluationDomainService;
import com.supportdesk.domain.routing.adapter.gateway.IDepartmentClassifier;
import com.supportdesk.domain.routing.model.valobj.DepartmentPrediction;
import com.supportdesk.domain.routing.service.DepartmentRoutingDomainService;
import com.supportdesk.domain.sla.service.SlaPolicyDomainService;
import com.supportdesk.domain.ticket.service.TicketTransitionDomainService;
import com.supportdesk.trigger.application.command.AgentAssignmentApplicationService;
import com.supportdesk.trigger.application.command.SlaBreachApplicationService;
import com.supportdesk.trigger.application.command.TicketActionCommandService;
import com.supportdesk.trigger.application.command.TicketLifecycleApplicationService;
import com.supportdesk.trigger.application.command.TicketRoutingApplicationService;
import com.supportdesk.trigger.service.EscalationOrchestratorService;
import com.supportdesk.types.enums.TicketPriorityEnum;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于内存仓储装配完整的工单用例链路。
 * <p>
 * 部门：1=Billing，2=Technical；规则：refund->1，error->2；
 * SLA：Billing/HIGH 首次响应 60 分钟、解决 240 分钟，Billing/CRITICAL 15/120；
 * 坐席：11、12 属于 Billing，21 属于 Technical，13 已停用。
 * </p>
 */
public class TriageTestContext implements AutoCloseable {

    public static final LocalDateTime START = LocalDateTime.of(2025, 3, 2, 9, 0);
    public static final Long BILLING = 1L;
    public static final Long TECHNICAL = 2L;

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryTicketRepository tickets = new InMemoryTicketRepository();
    public final InMemoryTicketEventRepository events = new InMemoryTicketEventRepository();
    public final InMemoryConversationRepository conversations = new InMemoryConversationRepository();
    public final InMemoryMessageRepository messages = new InMemoryMessageRepository();
    public final InMemoryRoutingCatalog catalog = new InMemoryRoutingCatalog()
            .department(BILLING, "Billing")
            .department(TECHNICAL, "Technical")
            .rule(101L, "refund", BILLING, 1)
            .rule(102L, "error", TECHNICAL, 2)
            .slaPolicy(BILLING, TicketPriorityEnum.HIGH, 60, 240)
            .slaPolicy(BILLING, TicketPriorityEnum.CRITICAL, 15, 120)
            .agent(11L, BILLING, true)
            .agent(12L, BILLING, true)
            .agent(13L, BILLING, false)
            .agent(21L, TECHNICAL, true);
    public final RecordingNotificationGateway notifications = new RecordingNotificationGateway();
    public final AtomicReference<DepartmentPrediction> prediction =
            new AtomicReference<>(DepartmentPrediction.unavailable("not scripted"));
    public final ExecutorService classifierExecutor = Executors.newFixedThreadPool(2);
    public final TicketTransitionDomainService transitionDomainService = new TicketTransitionDomainService();
    public final AgentAssignmentApplicationService agentAssignment;
    public final TicketLifecycleApplicationService lifecycle;
    public final TicketRoutingApplicationService routing;
    public final SlaBreachApplicationService slaBreach;
    public final TicketActionCommandService actions;
    public final EscalationOrchestratorService orchestrator;

    private IDepartmentClassifier classifier = (text, names) -> prediction.get();

    public TriageTestContext() {
        this(0.75D, 1000L);
    }

    public TriageTestContext(double confidenceThreshold, long classifierTimeoutMs) {
        TransactionOperations tx = TransactionOperations.withoutTransaction();
        this.agentAssignment = new AgentAssignmentApplicationService(
                catalog.supportAgentRepository(), tickets, new AgentAssignmentDomainService());
        this.lifecycle = new TicketLifecycleApplicationService(tickets, events, conversations, messages,
                transitionDomainService, tx, clock, 3, 1, 16);
        this.routing = new TicketRoutingApplicationService(
                (text, names) -> classifier.classify(text, names),
                catalog.departmentRepository(), catalog.routingRuleRepository(), tickets, events,
                new DepartmentRoutingDomainService(), new SlaPolicyDomainService(catalog.slaPolicyRepository()),
                agentAssignment, tx, classifierExecutor, clock, confidenceThreshold, classifierTimeoutMs, true, 1);
        this.slaBreach = new SlaBreachApplicationService(tickets, events, notifications, transitionDomainService, tx);
        this.actions = new TicketActionCommandService(tickets, events, catalog.supportAgentRepository(),
                transitionDomainService, agentAssignment, lifecycle, tx, clock);
        this.orchestrator = new EscalationOrchestratorService(messages, new EscalationEvaluationDomainService(),
                lifecycle, routing, -0.6D, -0.4D, 3, 3, "");
    }

    /**
     * 替换分类器实现，例如模拟超时或抛错。
     */
    public void useClassifier(IDepartmentClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public void close() {
        classifierExecutor.shutdownNow();
    }
}
