package com.supportdesk.api.dto;

import lombok.Data;

/**
 * 消息升级评估结果 DTO。
 */
@Data
public class EscalationResultDTO {

    /** NOT_ESCALATED / TICKET_CREATED / TICKET_REUSED / FAILED */
    private String outcome;
    private boolean escalated;
    private boolean ticketCreated;
    private Long ticketId;
    private String priority;
    private String reason;
    private String routingMethod;
    private Long departmentId;
    private Long assignedAgentId;
    private String errorMessage;
}
