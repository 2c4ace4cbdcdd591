package com.supportdesk.domain.ticket.adapter.repository;

import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;

import java.util.List;

/**
 * 工单事件仓储接口（只追加）
 */
public interface ITicketEventRepository {

    TicketEventEntity save(TicketEventEntity event);

    /**
     * 按写入顺序返回工单的全部事件
     */
    List<TicketEventEntity> findByTicketId(Long ticketId);
}
