package com.supportdesk.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 坐席 OPEN 工单数统计 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentOpenTicketCountPO {

    private Long agentId;

    private Long openTicketCount;
}
