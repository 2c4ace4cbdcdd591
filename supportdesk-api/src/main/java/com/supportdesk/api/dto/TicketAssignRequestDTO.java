package com.supportdesk.api.dto;

import lombok.Data;

/**
 * 工单改派请求。agentId 为空时按最少负载自动选择。
 */
@Data
public class TicketAssignRequestDTO {

    private Long agentId;
}
