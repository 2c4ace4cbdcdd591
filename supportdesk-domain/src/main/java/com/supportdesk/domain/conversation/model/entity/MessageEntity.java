package com.supportdesk.domain.conversation.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 消息领域实体（只读）。
 */
@Data
public class MessageEntity {

    private Long id;
    private Long conversationId;
    private String content;

    /**
     * 情感分，范围 [-1, 1]，未分析时为 null
     */
    private Double sentimentScore;

    private String sentimentLabel;
    private LocalDateTime createdAt;

    public boolean hasSentiment() {
        return sentimentScore != null && !sentimentScore.isNaN();
    }

    public String safeContent() {
        return content == null ? "" : content.trim();
    }
}
