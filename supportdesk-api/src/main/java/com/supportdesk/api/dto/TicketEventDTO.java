package com.supportdesk.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 工单审计事件 DTO。
 */
@Data
public class TicketEventDTO {

    private Long id;
    private Long ticketId;
    private String eventType;
    private String oldValue;
    private String newValue;
    private Map<String, Object> detail;
    private LocalDateTime createdAt;
}
