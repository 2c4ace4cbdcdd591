package com.supportdesk.domain.ticket.model.valobj;

/**
 * 坐席当前 OPEN 工单数
 */
public record AgentOpenTicketCount(Long agentId, long openTicketCount) {
}
