package com.supportdesk.infrastructure.repository.sla;

import com.supportdesk.domain.sla.adapter.repository.ISlaPolicyRepository;
import com.supportdesk.domain.sla.model.entity.SlaPolicyEntity;
import com.supportdesk.infrastructure.dao.SlaPolicyDao;
import com.supportdesk.infrastructure.dao.po.SlaPolicyPO;
import com.supportdesk.types.enums.TicketPriorityEnum;
import org.springframework.stereotype.Repository;

/**
 * SLA 策略仓储实现类。
 */
@Repository
public class SlaPolicyRepositoryImpl implements ISlaPolicyRepository {

    private final SlaPolicyDao slaPolicyDao;

    public SlaPolicyRepositoryImpl(SlaPolicyDao slaPolicyDao) {
        this.slaPolicyDao = slaPolicyDao;
    }

    @Override
    public SlaPolicyEntity findByDepartmentAndPriority(Long departmentId, TicketPriorityEnum priority) {
        if (departmentId == null || priority == null) {
            return null;
        }
        SlaPolicyPO po = slaPolicyDao.selectByDepartmentAndPriority(departmentId, priority);
        if (po == null) {
            return null;
        }
        SlaPolicyEntity entity = new SlaPolicyEntity();
        entity.setId(po.getId());
        entity.setDepartmentId(po.getDepartmentId());
        entity.setPriority(po.getPriority());
        entity.setFirstResponseMinutes(po.getFirstResponseMinutes());
        entity.setResolutionMinutes(po.getResolutionMinutes());
        entity.setEscalationMinutes(po.getEscalationMinutes());
        return entity;
    }
}
