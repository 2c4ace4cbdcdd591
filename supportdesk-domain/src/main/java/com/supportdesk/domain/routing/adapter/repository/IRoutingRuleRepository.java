package com.supportdesk.domain.routing.adapter.repository;

import com.supportdesk.domain.routing.model.entity.RoutingRuleEntity;

import java.util.List;

/**
 * 路由规则仓储接口
 */
public interface IRoutingRuleRepository {

    /**
     * 按 sort_order、id 升序返回全部规则
     */
    List<RoutingRuleEntity> findAllOrdered();
}
