package com.supportdesk.test.integration;

import com.supportdesk.Application;
import com.supportdesk.domain.conversation.adapter.repository.IConversationRepository;
import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.trigger.application.command.SlaBreachApplicationService;
import com.supportdesk.trigger.application.command.TicketLifecycleApplicationService;
import com.supportdesk.trigger.application.command.TicketLifecycleApplicationService.LifecycleResult;
import com.supportdesk.trigger.service.EscalationOrchestratorService;
import com.supportdesk.trigger.service.EscalationOrchestratorService.EscalationOutcome;
import com.supportdesk.trigger.service.EscalationOrchestratorService.OutcomeStatus;
import com.supportdesk.types.enums.ConversationStatusEnum;
import com.supportdesk.types.enums.RoutingMethodEnum;
import com.supportdesk.types.enums.TicketEventTypeEnum;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "spring.task.scheduling.enabled=false",
                "sla-monitor.enabled=false",
                "routing.ai.enabled=false"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class TicketTriageIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private ITicketRepository ticketRepository;

    @Autowired
    private ITicketEventRepository ticketEventRepository;

    @Autowired
    private IConversationRepository conversationRepository;

    @Autowired
    private TicketLifecycleApplicationService ticketLifecycleApplicationService;

    @Autowired
    private SlaBreachApplicationService slaBreachApplicationService;

    @Autowired
    private EscalationOrchestratorService escalationOrchestratorService;

    @Test
    public void shouldEscalateRouteAndAssignAgainstPostgres() {
        Long billing = insertDepartment("Billing");
        jdbcTemplate.update("INSERT INTO routing_rules (keyword, department_id, sort_order) VALUES ('refund', ?, 1)", billing);
        jdbcTemplate.update("INSERT INTO sla_policies (department_id, priority, first_response_minutes, resolution_minutes) VALUES (?, 'CRITICAL', 15, 120)", billing);
        Long agentId = insertAgent("alice", billing);
        Long conversationId = insertConversation();
        Long messageId = insertMessage(conversationId, "refund now or I call my lawyer", -0.8D);

        EscalationOutcome outcome = escalationOrchestratorService.process(conversationId, messageId);

        Assertions.assertEquals(OutcomeStatus.TICKET_CREATED, outcome.status(), outcome.errorMessage());
        TicketEntity ticket = ticketRepository.findById(outcome.ticket().getId());
        Assertions.assertEquals(TicketPriorityEnum.CRITICAL, ticket.getPriority());
        Assertions.assertEquals(billing, ticket.getDepartmentId());
        Assertions.assertEquals(RoutingMethodEnum.FALLBACK, ticket.getRoutingMethod());
        Assertions.assertEquals(agentId, ticket.getAssignedAgentId());
        Assertions.assertEquals(ticket.getCreatedAt().plusMinutes(15), ticket.getSlaDueAt());
        Assertions.assertEquals(ConversationStatusEnum.ESCALATED, conversationRepository.findById(conversationId).getStatus());

        List<TicketEventEntity> events = ticketEventRepository.findByTicketId(ticket.getId());
        Assertions.assertEquals(TicketEventTypeEnum.CREATED, events.get(0).getEventType());
        Assertions.assertEquals(TicketEventTypeEnum.ROUTED, events.get(1).getEventType());
        Assertions.assertEquals("FALLBACK", events.get(1).getDetail().get("routingMethod"));
        Assertions.assertEquals(TicketEventTypeEnum.ASSIGNED, events.get(2).getEventType());
    }

    @Test
    public void shouldRejectStaleTicketUpdate() {
        Long conversationId = insertConversation();
        TicketEntity ticket = TicketEntity.open(conversationId, null, TicketPriorityEnum.HIGH, "test", LocalDateTime.now());
        ticketRepository.save(ticket);
        TicketEntity first = ticketRepository.findById(ticket.getId());
        TicketEntity second = ticketRepository.findById(ticket.getId());

        first.setPriority(TicketPriorityEnum.CRITICAL);
        ticketRepository.update(first);
        second.setReason("stale");

        Assertions.assertThrows(OptimisticLockingFailureException.class, () -> ticketRepository.update(second));
        Assertions.assertEquals(1, ticketRepository.findById(ticket.getId()).getVersion());
    }

    @Test
    public void shouldKeepSingleOpenTicketUnderConcurrentEscalations() throws Exception {
        Long conversationId = insertConversation();
        Long messageId = insertMessage(conversationId, "this is useless", -0.9D);
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LifecycleResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<LifecycleResult> task = () -> {
                    start.await(2, TimeUnit.SECONDS);
                    return ticketLifecycleApplicationService.evaluateAndEscalate(conversationId, messageId,
                            TicketPriorityEnum.HIGH, "strong negative sentiment (score=-0.90)");
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<LifecycleResult> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Integer open = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM tickets WHERE conversation_id = ? AND status = 'OPEN'", Integer.class, conversationId);
        Assertions.assertEquals(1, open);
    }

    @Test
    public void shouldEscalateBreachedTicketExactlyOnce() {
        Long conversationId = insertConversation();
        LocalDateTime now = LocalDateTime.now();
        TicketEntity ticket = TicketEntity.open(conversationId, null, TicketPriorityEnum.MEDIUM, "test", now.minusHours(2));
        ticket.setSlaDueAt(now.minusMinutes(5));
        ticketRepository.save(ticket);

        SlaBreachApplicationService.SweepResult first = slaBreachApplicationService.sweep(now, 50);
        SlaBreachApplicationService.SweepResult second = slaBreachApplicationService.sweep(now, 50);

        Assertions.assertEquals(1, first.escalated());
        Assertions.assertEquals(0, second.scanned());
        TicketEntity stored = ticketRepository.findById(ticket.getId());
        Assertions.assertTrue(stored.isSlaBreached());
        Assertions.assertEquals(TicketPriorityEnum.HIGH, stored.getPriority());
        Assertions.assertEquals(TicketStatusEnum.OPEN, stored.getStatus());
    }
}
