package com.supportdesk.domain.ticket.model.valobj;

import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;

/**
 * 工单列表查询条件，status / priority 为空表示不过滤。
 */
public record TicketQuery(TicketStatusEnum status,
                          TicketPriorityEnum priority,
                          int offset,
                          int limit) {
}
