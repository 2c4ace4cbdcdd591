package com.supportdesk.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 消息 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessagePO {

    private Long id;

    /**
     * 会话 ID (关联 conversations.id)
     */
    private Long conversationId;

    private String content;

    /**
     * 情感分，可空
     */
    private Double sentimentScore;

    private String sentimentLabel;

    private LocalDateTime createdAt;
}
