package com.supportdesk.infrastructure.repository.assignment;

import com.supportdesk.domain.assignment.adapter.repository.ISupportAgentRepository;
import com.supportdesk.domain.assignment.model.entity.SupportAgentEntity;
import com.supportdesk.infrastructure.dao.SupportAgentDao;
import com.supportdesk.infrastructure.dao.po.SupportAgentPO;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 坐席仓储实现类。
 */
@Repository
public class SupportAgentRepositoryImpl implements ISupportAgentRepository {

    private final SupportAgentDao supportAgentDao;

    public SupportAgentRepositoryImpl(SupportAgentDao supportAgentDao) {
        this.supportAgentDao = supportAgentDao;
    }

    @Override
    public SupportAgentEntity findById(Long id) {
        return id == null ? null : toEntity(supportAgentDao.selectById(id));
    }

    @Override
    public List<SupportAgentEntity> findActiveAgents(Long departmentId) {
        return supportAgentDao.selectActive(departmentId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private SupportAgentEntity toEntity(SupportAgentPO po) {
        if (po == null) {
            return null;
        }
        SupportAgentEntity entity = new SupportAgentEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setRole(po.getRole());
        entity.setDepartmentId(po.getDepartmentId());
        entity.setActive(po.getActive());
        return entity;
    }
}
