package com.supportdesk.domain.sla.model.entity;

import com.supportdesk.types.enums.TicketPriorityEnum;
import lombok.Data;

/**
 * SLA 策略，（部门, 优先级）唯一。
 */
@Data
public class SlaPolicyEntity {

    private Long id;

    private Long departmentId;

    private TicketPriorityEnum priority;

    /**
     * 首次响应时限（分钟）
     */
    private Integer firstResponseMinutes;

    /**
     * 解决时限（分钟）
     */
    private Integer resolutionMinutes;

    /**
     * 升级时限（分钟），为空或非正数表示不设置
     */
    private Integer escalationMinutes;

    public void validate() {
        if (departmentId == null) {
            throw new IllegalStateException("Department ID cannot be null");
        }
        if (priority == null) {
            throw new IllegalStateException("Priority cannot be null");
        }
        if (firstResponseMinutes == null || firstResponseMinutes <= 0) {
            throw new IllegalStateException("First response minutes must be positive");
        }
        if (resolutionMinutes == null || resolutionMinutes <= 0) {
            throw new IllegalStateException("Resolution minutes must be positive");
        }
    }
}
