package com.supportdesk.test.domain;

import com.supportdesk.domain.conversation.model.entity.MessageEntity;
import com.supportdesk.domain.escalation.model.valobj.EscalationDecision;
import com.supportdesk.domain.escalation.model.valobj.EscalationPolicy;
import com.supportdesk.domain.escalation.model.valobj.EscalationRuleEnum;
import com.supportdesk.domain.escalation.service.EscalationEvaluationDomainService;
import com.supportdesk.types.enums.TicketPriorityEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class EscalationEvaluationDomainServiceTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2025, 3, 2, 10, 0);

    private final EscalationEvaluationDomainService service = new EscalationEvaluationDomainService();

    @Test
    public void shouldEscalateHighOnStrongNegativeSentiment() {
        MessageEntity latest = message(3L, -0.7D, "this is unacceptable", 3);

        EscalationDecision decision = service.evaluate(latest, List.of(latest), EscalationPolicy.defaults());

        Assertions.assertTrue(decision.escalate());
        Assertions.assertEquals(TicketPriorityEnum.HIGH, decision.priority());
        Assertions.assertEquals(List.of(EscalationRuleEnum.STRONG_NEGATIVE), decision.firedRules());
        Assertions.assertEquals("strong negative sentiment (score=-0.70)", decision.reason());
    }

    @Test
    public void shouldNotFireStrongRuleExactlyAtThreshold() {
        MessageEntity latest = message(3L, -0.6D, "hmm", 3);

        EscalationDecision decision = service.evaluate(latest, List.of(latest), EscalationPolicy.defaults());

        Assertions.assertFalse(decision.escalate());
        Assertions.assertNull(decision.priority());
    }

    @Test
    public void shouldEscalateMediumOnRepeatedNegativeAverage() {
        MessageEntity m1 = message(1L, -0.5D, "not great", 1);
        MessageEntity m2 = message(2L, -0.45D, "still broken", 2);
        MessageEntity m3 = message(3L, -0.5D, "please fix", 3);

        EscalationDecision decision = service.evaluate(m3, List.of(m3, m2, m1), EscalationPolicy.defaults());

        Assertions.assertTrue(decision.escalate());
        Assertions.assertEquals(TicketPriorityEnum.MEDIUM, decision.priority());
        Assertions.assertEquals(List.of(EscalationRuleEnum.REPEATED_NEGATIVE), decision.firedRules());
        Assertions.assertEquals("repeated moderate negative sentiment over last 3 messages (avg=-0.48)", decision.reason());
    }

    @Test
    public void shouldSkipRepeatedRuleWhenWindowIsShort() {
        MessageEntity m1 = message(1L, -0.5D, "not great", 1);
        MessageEntity m2 = message(2L, -0.5D, "still broken", 2);

        EscalationDecision decision = service.evaluate(m2, List.of(m2, m1), EscalationPolicy.defaults());

        Assertions.assertFalse(decision.escalate());
    }

    @Test
    public void shouldSkipRepeatedRuleWhenAnyScoreMissing() {
        MessageEntity m1 = message(1L, null, "not great", 1);
        MessageEntity m2 = message(2L, -0.5D, "still broken", 2);
        MessageEntity m3 = message(3L, -0.5D, "please fix", 3);

        EscalationDecision decision = service.evaluate(m3, List.of(m3, m2, m1), EscalationPolicy.defaults());

        Assertions.assertFalse(decision.escalate());
    }

    @Test
    public void shouldUseOnlyMostRecentMessagesForAverage() {
        MessageEntity old = message(1L, -0.9D, "terrible", 1);
        MessageEntity m2 = message(2L, 0.2D, "ok", 2);
        MessageEntity m3 = message(3L, -0.5D, "meh", 3);
        MessageEntity m4 = message(4L, -0.5D, "meh again", 4);

        EscalationDecision decision = service.evaluate(m4, List.of(old, m2, m3, m4), EscalationPolicy.defaults());

        Assertions.assertFalse(decision.escalate());
    }

    @Test
    public void shouldEscalateCriticalOnKeywordCaseInsensitive() {
        MessageEntity latest = message(3L, 0.1D, "I want to SPEAK TO A MANAGER now", 3);

        EscalationDecision decision = service.evaluate(latest, List.of(latest), EscalationPolicy.defaults());

        Assertions.assertTrue(decision.escalate());
        Assertions.assertEquals(TicketPriorityEnum.CRITICAL, decision.priority());
        Assertions.assertEquals("escalation keyword detected: 'speak to a manager'", decision.reason());
    }

    @Test
    public void shouldEvaluateKeywordEvenWhenSentimentMissing() {
        MessageEntity latest = message(3L, null, "I will call my lawyer", 3);

        EscalationDecision decision = service.evaluate(latest, List.of(latest), EscalationPolicy.defaults());

        Assertions.assertEquals(TicketPriorityEnum.CRITICAL, decision.priority());
    }

    @Test
    public void shouldTakeMaxPriorityAndJoinReasonsInRuleOrder() {
        MessageEntity m1 = message(1L, -0.5D, "bad", 1);
        MessageEntity m2 = message(2L, -0.5D, "worse", 2);
        MessageEntity m3 = message(3L, -0.8D, "need manager", 3);

        EscalationDecision decision = service.evaluate(m3, List.of(m1, m2, m3), EscalationPolicy.defaults());

        Assertions.assertEquals(TicketPriorityEnum.CRITICAL, decision.priority());
        Assertions.assertEquals(List.of(EscalationRuleEnum.STRONG_NEGATIVE, EscalationRuleEnum.REPEATED_NEGATIVE,
                EscalationRuleEnum.KEYWORD), decision.firedRules());
        String[] parts = decision.reason().split("; ");
        Assertions.assertEquals(3, parts.length);
        Assertions.assertTrue(parts[0].startsWith("strong negative"));
        Assertions.assertTrue(parts[1].startsWith("repeated moderate negative sentiment"));
        Assertions.assertTrue(parts[2].startsWith("escalation keyword"));
    }

    @Test
    public void shouldHonorCustomPolicy() {
        EscalationPolicy policy = EscalationPolicy.defaults().toBuilder()
                .strongNegativeThreshold(-0.3D)
                .keywords(List.of("chargeback"))
                .build();
        MessageEntity latest = message(3L, -0.35D, "need manager", 3);

        EscalationDecision decision = service.evaluate(latest, List.of(latest), policy);

        Assertions.assertEquals(List.of(EscalationRuleEnum.STRONG_NEGATIVE), decision.firedRules());
    }

    @Test
    public void shouldReturnNoneForNullMessage() {
        EscalationDecision decision = service.evaluate(null, List.of(), EscalationPolicy.defaults());

        Assertions.assertFalse(decision.escalate());
        Assertions.assertTrue(decision.firedRules().isEmpty());
    }

    private MessageEntity message(Long id, Double score, String content, int minuteOffset) {
        MessageEntity message = new MessageEntity();
        message.setId(id);
        message.setConversationId(10L);
        message.setContent(content);
        message.setSentimentScore(score);
        message.setCreatedAt(BASE.plusMinutes(minuteOffset));
        return message;
    }
}
