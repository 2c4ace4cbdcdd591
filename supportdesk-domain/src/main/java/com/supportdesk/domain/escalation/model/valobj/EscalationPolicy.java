package com.supportdesk.domain.escalation.model.valobj;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * 升级判定参数
 */
@Getter
@Builder(toBuilder = true)
public class EscalationPolicy {

    public static final double DEFAULT_STRONG_NEGATIVE_THRESHOLD = -0.6D;
    public static final double DEFAULT_MODERATE_NEGATIVE_THRESHOLD = -0.4D;
    public static final int DEFAULT_RECENT_MESSAGE_COUNT = 3;
    public static final Duration DEFAULT_REPEAT_WINDOW = Duration.ofHours(3);
    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "need manager",
            "speak to a manager",
            "human agent",
            "legal action",
            "lawyer",
            "refund now",
            "cancel my account"
    );

    private final double strongNegativeThreshold;
    private final double moderateNegativeThreshold;
    private final int recentMessageCount;
    private final Duration repeatWindow;
    private final List<String> keywords;

    public static EscalationPolicy defaults() {
        return EscalationPolicy.builder()
                .strongNegativeThreshold(DEFAULT_STRONG_NEGATIVE_THRESHOLD)
                .moderateNegativeThreshold(DEFAULT_MODERATE_NEGATIVE_THRESHOLD)
                .recentMessageCount(DEFAULT_RECENT_MESSAGE_COUNT)
                .repeatWindow(DEFAULT_REPEAT_WINDOW)
                .keywords(DEFAULT_KEYWORDS)
                .build();
    }
}
