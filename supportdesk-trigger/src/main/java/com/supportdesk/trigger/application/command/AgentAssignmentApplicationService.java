package com.supportdesk.trigger.application.command;

import com.supportdesk.domain.assignment.adapter.repository.ISupportAgentRepository;
import com.supportdesk.domain.assignment.model.entity.SupportAgentEntity;
import com.supportdesk.domain.assignment.service.AgentAssignmentDomainService;
import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.valobj.AgentOpenTicketCount;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 坐席选择用例：加载候选坐席与其 OPEN 工单数，交给领域服务挑选。
 */
@Service
public class AgentAssignmentApplicationService {

    private final ISupportAgentRepository supportAgentRepository;
    private final ITicketRepository ticketRepository;
    private final AgentAssignmentDomainService agentAssignmentDomainService;

    public AgentAssignmentApplicationService(ISupportAgentRepository supportAgentRepository,
                                             ITicketRepository ticketRepository,
                                             AgentAssignmentDomainService agentAssignmentDomainService) {
        this.supportAgentRepository = supportAgentRepository;
        this.ticketRepository = ticketRepository;
        this.agentAssignmentDomainService = agentAssignmentDomainService;
    }

    /**
     * @param departmentId   目标部门，为空时在全部活跃坐席中挑选
     * @param excludeAgentId 需要排除的坐席（改派时排除当前坐席），可空
     * @return 选中的坐席，无候选时返回 null
     */
    public SupportAgentEntity selectAgent(Long departmentId, Long excludeAgentId) {
        List<SupportAgentEntity> candidates = new ArrayList<>();
        for (SupportAgentEntity agent : supportAgentRepository.findActiveAgents(departmentId)) {
            if (agent != null && !Objects.equals(agent.getId(), excludeAgentId)) {
                candidates.add(agent);
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }
        List<Long> agentIds = new ArrayList<>(candidates.size());
        for (SupportAgentEntity agent : candidates) {
            agentIds.add(agent.getId());
        }
        Map<Long, Long> load = new HashMap<>();
        for (AgentOpenTicketCount count : ticketRepository.countOpenByAssignees(agentIds)) {
            load.put(count.agentId(), count.openTicketCount());
        }
        return agentAssignmentDomainService.selectLeastLoaded(candidates, load, departmentId);
    }
}
