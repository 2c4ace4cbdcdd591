package com.supportdesk.domain.assignment.service;

import com.supportdesk.domain.assignment.model.entity.SupportAgentEntity;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 坐席分配领域服务：最少负载优先。
 */
@Service
public class AgentAssignmentDomainService {

    /**
     * @param candidates     候选坐席
     * @param openTicketLoad 坐席 ID -> 当前 OPEN 工单数，缺失视为 0
     * @param departmentId   目标部门，为空时不限部门
     * @return 选中的坐席，无可用坐席时返回 null
     */
    public SupportAgentEntity selectLeastLoaded(List<SupportAgentEntity> candidates,
                                                Map<Long, Long> openTicketLoad,
                                                Long departmentId) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        Map<Long, Long> load = openTicketLoad == null ? Map.of() : openTicketLoad;
        return candidates.stream()
                .filter(agent -> agent != null && agent.getId() != null && agent.isAssignableTo(departmentId))
                .min(Comparator.<SupportAgentEntity>comparingLong(agent -> load.getOrDefault(agent.getId(), 0L))
                        .thenComparing(SupportAgentEntity::getId))
                .orElse(null);
    }
}
