package com.supportdesk.domain.routing.model.valobj;

import com.supportdesk.types.enums.RoutingMethodEnum;

/**
 * 路由决策。departmentId 为空时 routingMethod 也为空；AI 分析字段无论是否采纳都会保留。
 */
public record RoutingDecision(Long departmentId,
                              RoutingMethodEnum routingMethod,
                              Long matchedRuleId,
                              Double aiConfidence,
                              String aiPredictedDepartment) {

    public boolean routed() {
        return departmentId != null;
    }
}
