package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.RoutingRulePO;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

/**
 * 路由规则 DAO
 */
@Mapper
public interface RoutingRuleDao {

    /**
     * 按 sort_order, id 升序查询
     */
    List<RoutingRulePO> selectAllOrdered();
}
