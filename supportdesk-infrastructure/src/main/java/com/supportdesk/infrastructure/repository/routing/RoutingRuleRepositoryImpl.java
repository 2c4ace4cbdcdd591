package com.supportdesk.infrastructure.repository.routing;

import com.supportdesk.domain.routing.adapter.repository.IRoutingRuleRepository;
import com.supportdesk.domain.routing.model.entity.RoutingRuleEntity;
import com.supportdesk.infrastructure.dao.RoutingRuleDao;
import com.supportdesk.infrastructure.dao.po.RoutingRulePO;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 路由规则仓储实现类。
 */
@Repository
public class RoutingRuleRepositoryImpl implements IRoutingRuleRepository {

    private final RoutingRuleDao routingRuleDao;

    public RoutingRuleRepositoryImpl(RoutingRuleDao routingRuleDao) {
        this.routingRuleDao = routingRuleDao;
    }

    @Override
    public List<RoutingRuleEntity> findAllOrdered() {
        return routingRuleDao.selectAllOrdered().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private RoutingRuleEntity toEntity(RoutingRulePO po) {
        RoutingRuleEntity entity = new RoutingRuleEntity();
        entity.setId(po.getId());
        entity.setKeyword(po.getKeyword());
        entity.setDepartmentId(po.getDepartmentId());
        entity.setSortOrder(po.getSortOrder());
        return entity;
    }
}
