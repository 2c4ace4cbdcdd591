package com.supportdesk.domain.escalation.service;

import com.supportdesk.domain.conversation.model.entity.MessageEntity;
import com.supportdesk.domain.escalation.model.valobj.EscalationDecision;
import com.supportdesk.domain.escalation.model.valobj.EscalationPolicy;
import com.supportdesk.domain.escalation.model.valobj.EscalationRuleEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 升级判定领域服务（纯函数，无副作用）。
 */
@Service
public class EscalationEvaluationDomainService {

    /**
     * @param latest 最新消息
     * @param recent 会话中截止到最新消息的最近消息（顺序不限，可包含 latest）
     * @param policy 判定参数
     */
    public EscalationDecision evaluate(MessageEntity latest, List<MessageEntity> recent, EscalationPolicy policy) {
        if (latest == null) {
            return EscalationDecision.none();
        }
        EscalationPolicy effective = policy == null ? EscalationPolicy.defaults() : policy;
        List<EscalationRuleEnum> fired = new ArrayList<>();
        List<String> reasons = new ArrayList<>();

        if (latest.hasSentiment() && latest.getSentimentScore() < effective.getStrongNegativeThreshold()) {
            fired.add(EscalationRuleEnum.STRONG_NEGATIVE);
            reasons.add(String.format(Locale.ROOT, "strong negative sentiment (score=%.2f)", latest.getSentimentScore()));
        }

        Double average = averageOfWindow(latest, recent, effective.getRecentMessageCount());
        if (average != null && average < effective.getModerateNegativeThreshold()) {
            fired.add(EscalationRuleEnum.REPEATED_NEGATIVE);
            reasons.add(String.format(Locale.ROOT, "repeated moderate negative sentiment over last %d messages (avg=%.2f)",
                    effective.getRecentMessageCount(), average));
        }

        String keyword = matchKeyword(latest.getContent(), effective.getKeywords());
        if (keyword != null) {
            fired.add(EscalationRuleEnum.KEYWORD);
            reasons.add("escalation keyword detected: '" + keyword + "'");
        }
        return EscalationDecision.of(fired, reasons);
    }

    /**
     * 窗口内消息不足 N 条或存在未分析的消息时返回 null。
     */
    Double averageOfWindow(MessageEntity latest, List<MessageEntity> recent, int windowSize) {
        if (windowSize <= 0) {
            return null;
        }
        List<MessageEntity> window = latestWindow(latest, recent, windowSize);
        if (window.size() < windowSize) {
            return null;
        }
        double sum = 0D;
        for (MessageEntity message : window) {
            if (!message.hasSentiment()) {
                return null;
            }
            sum += message.getSentimentScore();
        }
        return sum / windowSize;
    }

    private List<MessageEntity> latestWindow(MessageEntity latest, List<MessageEntity> recent, int windowSize) {
        List<MessageEntity> candidates = new ArrayList<>();
        candidates.add(latest);
        if (recent != null) {
            for (MessageEntity message : recent) {
                if (message == null || Objects.equals(message.getId(), latest.getId())) {
                    continue;
                }
                candidates.add(message);
            }
        }
        return candidates.stream()
                .sorted(Comparator.comparing(MessageEntity::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(MessageEntity::getId, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .reversed())
                .limit(windowSize)
                .collect(Collectors.toList());
    }

    private String matchKeyword(String content, List<String> keywords) {
        if (StringUtils.isBlank(content) || keywords == null || keywords.isEmpty()) {
            return null;
        }
        String normalized = content.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (StringUtils.isBlank(keyword)) {
                continue;
            }
            if (normalized.contains(keyword.trim().toLowerCase(Locale.ROOT))) {
                return keyword.trim();
            }
        }
        return null;
    }
}
