package com.supportdesk.infrastructure.repository.routing;

import com.supportdesk.domain.routing.adapter.repository.IDepartmentRepository;
import com.supportdesk.domain.routing.model.entity.DepartmentEntity;
import com.supportdesk.infrastructure.dao.DepartmentDao;
import com.supportdesk.infrastructure.dao.po.DepartmentPO;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 部门仓储实现类。
 */
@Repository
public class DepartmentRepositoryImpl implements IDepartmentRepository {

    private final DepartmentDao departmentDao;

    public DepartmentRepositoryImpl(DepartmentDao departmentDao) {
        this.departmentDao = departmentDao;
    }

    @Override
    public DepartmentEntity findById(Long id) {
        return id == null ? null : toEntity(departmentDao.selectById(id));
    }

    @Override
    public List<DepartmentEntity> findAll() {
        return departmentDao.selectAll().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private DepartmentEntity toEntity(DepartmentPO po) {
        if (po == null) {
            return null;
        }
        DepartmentEntity entity = new DepartmentEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setManagerId(po.getManagerId());
        return entity;
    }
}
