package com.supportdesk.domain.assignment.adapter.repository;

import com.supportdesk.domain.assignment.model.entity.SupportAgentEntity;

import java.util.List;

/**
 * 坐席仓储接口
 */
public interface ISupportAgentRepository {

    SupportAgentEntity findById(Long id);

    /**
     * 查询部门下的活跃坐席，departmentId 为空时返回全部活跃坐席
     */
    List<SupportAgentEntity> findActiveAgents(Long departmentId);
}
