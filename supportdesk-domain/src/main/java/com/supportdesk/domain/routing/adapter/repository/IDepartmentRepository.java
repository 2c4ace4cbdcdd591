package com.supportdesk.domain.routing.adapter.repository;

import com.supportdesk.domain.routing.model.entity.DepartmentEntity;

import java.util.List;

/**
 * 部门仓储接口
 */
public interface IDepartmentRepository {

    DepartmentEntity findById(Long id);

    List<DepartmentEntity> findAll();
}
