package com.supportdesk.domain.ticket.model.entity;

import com.supportdesk.types.enums.RoutingMethodEnum;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 工单领域实体
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Data
public class TicketEntity {

    private static final Map<TicketStatusEnum, Set<TicketStatusEnum>> ALLOWED_TRANSITIONS = Map.of(
            TicketStatusEnum.OPEN, EnumSet.of(TicketStatusEnum.IN_PROGRESS, TicketStatusEnum.CLOSED),
            TicketStatusEnum.IN_PROGRESS, EnumSet.of(TicketStatusEnum.RESOLVED, TicketStatusEnum.CLOSED),
            TicketStatusEnum.RESOLVED, EnumSet.of(TicketStatusEnum.CLOSED, TicketStatusEnum.OPEN),
            TicketStatusEnum.CLOSED, EnumSet.noneOf(TicketStatusEnum.class)
    );

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 会话 ID
     */
    private Long conversationId;

    /**
     * 触发建单/复用的最新消息 ID
     */
    private Long lastMessageId;

    private TicketStatusEnum status;

    private TicketPriorityEnum priority;

    /**
     * 升级原因（多条以 "; " 连接）
     */
    private String reason;

    /**
     * 所属部门（未路由时为空）
     */
    private Long departmentId;

    private Long assignedAgentId;

    /**
     * 路由方式（未路由时为空）
     */
    private RoutingMethodEnum routingMethod;

    /**
     * AI 置信度，仅用于分析，即便未采纳也会记录
     */
    private Double aiConfidence;

    /**
     * AI 预测部门名称
     */
    private String aiPredictedDepartment;

    /**
     * 首次响应截止时间
     */
    private LocalDateTime slaDueAt;

    /**
     * 解决截止时间
     */
    private LocalDateTime resolutionDueAt;

    /**
     * 是否已违约（粘性标记，一次违约只升级一次）
     */
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

    /**
     * 新建 OPEN 工单。
     */
    public static TicketEntity open(Long conversationId,
                                    Long messageId,
                                    TicketPriorityEnum priority,
                                    String reason,
                                    LocalDateTime now) {
        TicketEntity ticket = new TicketEntity();
        ticket.setConversationId(conversationId);
        ticket.setLastMessageId(messageId);
        ticket.setStatus(TicketStatusEnum.OPEN);
        ticket.setPriority(priority);
        ticket.setReason(reason);
        ticket.setSlaBreached(false);
        ticket.setEscalationLevel(0);
        ticket.setReassignedCount(0);
        ticket.setVersion(0);
        ticket.setCreatedAt(now);
        ticket.setUpdatedAt(now);
        return ticket;
    }

    /**
     * 验证工单是否有效
     */
    public void validate() {
        if (conversationId == null) {
            throw new IllegalStateException("Conversation ID cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (priority == null) {
            throw new IllegalStateException("Priority cannot be null");
        }
    }

    public boolean isOpen() {
        return status == TicketStatusEnum.OPEN;
    }

    public boolean isRouted() {
        return departmentId != null;
    }

    public boolean isSlaBreached() {
        return Boolean.TRUE.equals(slaBreached);
    }

    public int escalationLevelValue() {
        return escalationLevel == null ? 0 : escalationLevel;
    }

    public int reassignedCountValue() {
        return reassignedCount == null ? 0 : reassignedCount;
    }

    /**
     * 复用已存在的 OPEN 工单：优先级只升不降，原因追加。
     */
    public void absorbEscalation(TicketPriorityEnum incomingPriority,
                                 String mergedReason,
                                 Long messageId,
                                 LocalDateTime now) {
        if (!isOpen()) {
            throw new IllegalStateException("Only OPEN tickets can absorb escalations");
        }
        this.priority = TicketPriorityEnum.max(this.priority, incomingPriority);
        this.reason = mergedReason;
        if (messageId != null) {
            this.lastMessageId = messageId;
        }
        this.updatedAt = now;
    }

    /**
     * 写入路由结果
     */
    public void applyRouting(Long departmentId,
                             RoutingMethodEnum routingMethod,
                             Double aiConfidence,
                             String aiPredictedDepartment,
                             LocalDateTime now) {
        this.departmentId = departmentId;
        this.routingMethod = departmentId == null ? null : routingMethod;
        this.aiConfidence = aiConfidence;
        this.aiPredictedDepartment = aiPredictedDepartment;
        this.updatedAt = now;
    }

    /**
     * 写入 SLA 截止时间，传 null 表示无适用策略。
     */
    public void applyDeadlines(LocalDateTime firstResponseDueAt, LocalDateTime resolutionDueAt, LocalDateTime now) {
        this.slaDueAt = firstResponseDueAt;
        this.resolutionDueAt = resolutionDueAt;
        this.updatedAt = now;
    }

    /**
     * 分配给坐席，换人时累计改派次数。
     */
    public void assignTo(Long agentId, LocalDateTime now) {
        if (agentId == null) {
            throw new IllegalStateException("Agent ID cannot be null");
        }
        if (status == TicketStatusEnum.CLOSED) {
            throw new IllegalStateException("Closed tickets cannot be assigned");
        }
        if (this.assignedAgentId != null && !this.assignedAgentId.equals(agentId)) {
            this.reassignedCount = reassignedCountValue() + 1;
        }
        this.assignedAgentId = agentId;
        this.assignedAt = now;
        this.updatedAt = now;
    }

    /**
     * 是否处于违约状态（OPEN、未标记、首次响应截止时间已过）。
     */
    public boolean isBreachCandidate(LocalDateTime now) {
        return isOpen() && !isSlaBreached() && slaDueAt != null && now != null && slaDueAt.isBefore(now);
    }

    /**
     * 标记违约并上调一级优先级。
     *
     * @return 本次是否发生了变更
     */
    public boolean markSlaBreached(LocalDateTime now) {
        if (!isBreachCandidate(now)) {
            return false;
        }
        this.slaBreached = true;
        this.priority = this.priority == null ? TicketPriorityEnum.HIGH : this.priority.escalate();
        this.escalationLevel = escalationLevelValue() + 1;
        this.updatedAt = now;
        return true;
    }

    public boolean canTransitTo(TicketStatusEnum target) {
        if (status == null || target == null) {
            return false;
        }
        return ALLOWED_TRANSITIONS.getOrDefault(status, Set.of()).contains(target);
    }

    /**
     * 人工状态流转
     */
    public void transitTo(TicketStatusEnum target, LocalDateTime now) {
        if (!canTransitTo(target)) {
            throw new IllegalStateException("Ticket cannot transit from " + status + " to " + target);
        }
        if (target == TicketStatusEnum.IN_PROGRESS && firstResponseAt == null) {
            this.firstResponseAt = now;
        }
        if (target == TicketStatusEnum.CLOSED) {
            this.closedAt = now;
        }
        if (target == TicketStatusEnum.OPEN) {
            this.closedAt = null;
        }
        this.status = target;
        this.updatedAt = now;
    }
}
