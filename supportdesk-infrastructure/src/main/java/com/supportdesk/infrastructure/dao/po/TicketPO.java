package com.supportdesk.infrastructure.dao.po;

import com.supportdesk.types.enums.RoutingMethodEnum;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工单 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 会话 ID (关联 conversations.id)
     */
    private Long conversationId;

    private Long lastMessageId;

    private TicketStatusEnum status;

    private TicketPriorityEnum priority;

    private String reason;

    private Long departmentId;

    private Long assignedAgentId;

    private RoutingMethodEnum routingMethod;

    private Double aiConfidence;

    private String aiPredictedDepartment;

    /**
     * 首次响应截止时间
     */
    private LocalDateTime slaDueAt;

    private LocalDateTime resolutionDueAt;

    private Boolean slaBreached;

    private Integer escalationLevel;

    private Integer reassignedCount;

    private LocalDateTime assignedAt;

    private LocalDateTime firstResponseAt;

    private LocalDateTime closedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
