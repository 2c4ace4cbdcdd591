package com.supportdesk.domain.sla.service;

import com.supportdesk.domain.sla.adapter.repository.ISlaPolicyRepository;
import com.supportdesk.domain.sla.model.entity.SlaPolicyEntity;
import com.supportdesk.domain.sla.model.valobj.SlaDeadline;
import com.supportdesk.types.enums.TicketPriorityEnum;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * SLA 策略领域服务
 */
@Service
public class SlaPolicyDomainService {

    private final ISlaPolicyRepository slaPolicyRepository;

    public SlaPolicyDomainService(ISlaPolicyRepository slaPolicyRepository) {
        this.slaPolicyRepository = slaPolicyRepository;
    }

    /**
     * 解析截止时间，部门/优先级缺失或无策略时返回 null。
     *
     * @param baseline 计算基准，取工单创建时间
     */
    public SlaDeadline resolve(Long departmentId, TicketPriorityEnum priority, LocalDateTime baseline) {
        if (departmentId == null || priority == null || baseline == null) {
            return null;
        }
        SlaPolicyEntity policy = slaPolicyRepository.findByDepartmentAndPriority(departmentId, priority);
        if (policy == null) {
            return null;
        }
        return compute(policy, baseline);
    }

    public SlaDeadline compute(SlaPolicyEntity policy, LocalDateTime baseline) {
        policy.validate();
        LocalDateTime escalationDueAt = null;
        if (policy.getEscalationMinutes() != null && policy.getEscalationMinutes() > 0) {
            escalationDueAt = baseline.plusMinutes(policy.getEscalationMinutes());
        }
        return new SlaDeadline(
                baseline.plusMinutes(policy.getFirstResponseMinutes()),
                baseline.plusMinutes(policy.getResolutionMinutes()),
                escalationDueAt
        );
    }
}
