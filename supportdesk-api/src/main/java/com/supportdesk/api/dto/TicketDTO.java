package com.supportdesk.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 工单视图 DTO。
 */
@Data
public class TicketDTO {

    private Long id;
    private Long conversationId;
    private String status;
    private String priority;
    private Long departmentId;
    private Long assignedAgentId;
    private String routingMethod;
    private Double aiConfidence;
    private String aiPredictedDepartment;
    private String reason;
    private Long lastMessageId;
    private LocalDateTime slaDueAt;
    private LocalDateTime resolutionDueAt;
    private Boolean slaBreached;
    private Integer escalationLevel;
    private Integer reassignedCount;
    private LocalDateTime assignedAt;
    private LocalDateTime firstResponseAt;
    private LocalDateTime closedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
