package com.supportdesk.domain.sla.adapter.repository;

import com.supportdesk.domain.sla.model.entity.SlaPolicyEntity;
import com.supportdesk.types.enums.TicketPriorityEnum;

/**
 * SLA 策略仓储接口
 */
public interface ISlaPolicyRepository {

    SlaPolicyEntity findByDepartmentAndPriority(Long departmentId, TicketPriorityEnum priority);
}
