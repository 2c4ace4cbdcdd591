package com.supportdesk.test;

import com.supportdesk.domain.routing.model.valobj.DepartmentPrediction;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.test.support.TriageTestContext;
import com.supportdesk.trigger.application.command.TicketRoutingApplicationService.RoutingResult;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.enums.RoutingMethodEnum;
import com.supportdesk.types.enums.TicketEventTypeEnum;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.exception.AppException;
import com.supportdesk.types.exception.TransientDependencyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class TicketRoutingApplicationServiceTest {

    private TriageTestContext context;

    @AfterEach
    public void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    @Test
    public void shouldAcceptConfidentPrediction() {
        context = new TriageTestContext();
        context.prediction.set(DepartmentPrediction.of("billing", 0.92D));
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);
        context.clock.advance(Duration.ofMinutes(5));

        RoutingResult result = context.routing.route(ticket.getId(), "my invoice looks wrong");

        TicketEntity routed = context.tickets.findById(ticket.getId());
        Assertions.assertEquals(TriageTestContext.BILLING, routed.getDepartmentId());
        Assertions.assertEquals(RoutingMethodEnum.AI, routed.getRoutingMethod());
        Assertions.assertEquals(0.92D, routed.getAiConfidence());
        Assertions.assertEquals("billing", routed.getAiPredictedDepartment());
        // SLA 以工单创建时间为基准
        Assertions.assertEquals(TriageTestContext.START.plusMinutes(60), routed.getSlaDueAt());
        Assertions.assertEquals(TriageTestContext.START.plusMinutes(240), routed.getResolutionDueAt());
        Assertions.assertEquals(11L, routed.getAssignedAgentId());
        Assertions.assertNotNull(result.deadline());
        Assertions.assertEquals(List.of(TicketEventTypeEnum.ROUTED, TicketEventTypeEnum.ASSIGNED),
                context.events.typesOf(ticket.getId()));
        TicketEventEntity routedEvent = context.events.findByTicketId(ticket.getId()).get(0);
        Assertions.assertEquals("AI", routedEvent.getDetail().get("routingMethod"));
        Assertions.assertEquals(Boolean.TRUE, routedEvent.getDetail().get("slaTracked"));
    }

    @Test
    public void shouldFallBackToKeywordWhenConfidenceLow() {
        context = new TriageTestContext();
        context.prediction.set(DepartmentPrediction.of("Technical", 0.5D));
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);

        RoutingResult result = context.routing.route(ticket.getId(), "I want a REFUND now");

        Assertions.assertEquals(TriageTestContext.BILLING, result.ticket().getDepartmentId());
        Assertions.assertEquals(RoutingMethodEnum.FALLBACK, result.ticket().getRoutingMethod());
        Assertions.assertEquals(101L, result.decision().matchedRuleId());
        // 未采纳的 AI 分析也要保留
        Assertions.assertEquals(0.5D, result.ticket().getAiConfidence());
        Assertions.assertEquals("Technical", result.ticket().getAiPredictedDepartment());
    }

    @Test
    public void shouldFallBackWhenPredictedDepartmentUnknown() {
        context = new TriageTestContext();
        context.prediction.set(DepartmentPrediction.of("Legal", 0.99D));
        TicketEntity ticket = openTicket(TicketPriorityEnum.MEDIUM);

        RoutingResult result = context.routing.route(ticket.getId(), "login error again");

        Assertions.assertEquals(TriageTestContext.TECHNICAL, result.ticket().getDepartmentId());
        Assertions.assertEquals(RoutingMethodEnum.FALLBACK, result.ticket().getRoutingMethod());
        Assertions.assertEquals(21L, result.ticket().getAssignedAgentId());
        Assertions.assertNull(result.ticket().getSlaDueAt());
    }

    @Test
    public void shouldFallBackWhenClassifierTimesOut() {
        context = new TriageTestContext(0.75D, 50L);
        CountDownLatch release = new CountDownLatch(1);
        context.useClassifier((text, names) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return DepartmentPrediction.of("Billing", 0.99D);
        });
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);

        long startNanos = System.nanoTime();
        RoutingResult result = context.routing.route(ticket.getId(), "there is an error on checkout");
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        release.countDown();

        Assertions.assertTrue(elapsedMs < 2000, "routing must not wait for the slow classifier");
        Assertions.assertEquals(TriageTestContext.TECHNICAL, result.ticket().getDepartmentId());
        Assertions.assertEquals(RoutingMethodEnum.FALLBACK, result.ticket().getRoutingMethod());
        Assertions.assertNull(result.ticket().getAiConfidence());
    }

    @Test
    public void shouldFallBackWhenClassifierFails() {
        context = new TriageTestContext();
        context.useClassifier((text, names) -> {
            throw new TransientDependencyException("classifier returned garbage");
        });
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);

        RoutingResult result = context.routing.route(ticket.getId(), "refund please");

        Assertions.assertEquals(RoutingMethodEnum.FALLBACK, result.ticket().getRoutingMethod());
        Assertions.assertEquals(TriageTestContext.BILLING, result.ticket().getDepartmentId());
    }

    @Test
    public void shouldFallBackWhenClassifierExecutorRejects() {
        context = new TriageTestContext();
        context.prediction.set(DepartmentPrediction.of("Billing", 0.99D));
        context.classifierExecutor.shutdown();
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);

        RoutingResult result = context.routing.route(ticket.getId(), "error 500");

        Assertions.assertEquals(RoutingMethodEnum.FALLBACK, result.ticket().getRoutingMethod());
        Assertions.assertEquals(TriageTestContext.TECHNICAL, result.ticket().getDepartmentId());
    }

    @Test
    public void shouldLeaveTicketUnroutedWithoutSla() {
        context = new TriageTestContext();
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);

        RoutingResult result = context.routing.route(ticket.getId(), "hello?");

        TicketEntity stored = context.tickets.findById(ticket.getId());
        Assertions.assertFalse(result.decision().routed());
        Assertions.assertNull(stored.getDepartmentId());
        Assertions.assertNull(stored.getRoutingMethod());
        Assertions.assertNull(stored.getSlaDueAt());
        Assertions.assertNull(result.deadline());
        TicketEventEntity routedEvent = context.events.findByTicketId(ticket.getId()).get(0);
        Assertions.assertEquals(TicketEventTypeEnum.ROUTED, routedEvent.getEventType());
        Assertions.assertEquals(Boolean.FALSE, routedEvent.getDetail().get("slaTracked"));
    }

    @Test
    public void shouldAssignLeastLoadedActiveAgent() {
        context = new TriageTestContext();
        context.prediction.set(DepartmentPrediction.of("Billing", 0.9D));
        TicketEntity busy = openTicket(TicketPriorityEnum.HIGH);
        busy.setAssignedAgentId(11L);
        context.tickets.put(busy);
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);

        RoutingResult result = context.routing.route(ticket.getId(), "invoice");

        Assertions.assertEquals(12L, result.ticket().getAssignedAgentId());
    }

    @Test
    public void shouldRejectUnknownTicket() {
        context = new TriageTestContext();

        AppException ex = Assertions.assertThrows(AppException.class, () -> context.routing.route(404L, "refund"));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
    }

    @Test
    public void shouldResolveSlaFromPriorityRaisedWhileClassifying() {
        context = new TriageTestContext();
        TicketEntity ticket = openTicket(TicketPriorityEnum.HIGH);
        context.useClassifier((text, names) -> {
            TicketEntity concurrent = context.tickets.findById(ticket.getId());
            concurrent.setPriority(TicketPriorityEnum.CRITICAL);
            context.tickets.update(concurrent);
            return DepartmentPrediction.of("billing", 0.95D);
        });

        RoutingResult result = context.routing.route(ticket.getId(), "refund now or I call my lawyer");

        TicketEntity routed = context.tickets.findById(ticket.getId());
        Assertions.assertEquals(TicketPriorityEnum.CRITICAL, routed.getPriority());
        Assertions.assertEquals(TriageTestContext.START.plusMinutes(15), routed.getSlaDueAt());
        Assertions.assertEquals(TriageTestContext.START.plusMinutes(120), routed.getResolutionDueAt());
        Assertions.assertEquals(TriageTestContext.START.plusMinutes(15), result.deadline().firstResponseDueAt());
    }

    private TicketEntity openTicket(TicketPriorityEnum priority) {
        return context.tickets.put(TicketEntity.open(1L, 1L, priority, "test", TriageTestContext.START));
    }
}
