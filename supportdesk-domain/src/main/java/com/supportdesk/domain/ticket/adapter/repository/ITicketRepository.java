package com.supportdesk.domain.ticket.adapter.repository;

import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.valobj.AgentOpenTicketCount;
import com.supportdesk.domain.ticket.model.valobj.TicketQuery;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 工单仓储接口
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public interface ITicketRepository {

    /**
     * 保存工单
     */
    TicketEntity save(TicketEntity entity);

    /**
     * 更新工单 (带乐观锁)，版本不匹配时抛出并发失败异常
     */
    TicketEntity update(TicketEntity entity);

    /**
     * 根据 ID 查询
     */
    TicketEntity findById(Long id);

    /**
     * 查询会话在 createdSince 之后创建的最新 OPEN 工单
     */
    TicketEntity findLatestOpenByConversationSince(Long conversationId, LocalDateTime createdSince);

    /**
     * 查询首次响应已超时、尚未标记违约的 OPEN 工单，按截止时间升序
     */
    List<TicketEntity> findSlaBreachCandidates(LocalDateTime now, int limit);

    /**
     * 统计坐席当前持有的 OPEN 工单数，没有工单的坐席不返回
     */
    List<AgentOpenTicketCount> countOpenByAssignees(Collection<Long> agentIds);

    /**
     * 条件分页查询
     */
    List<TicketEntity> findByQuery(TicketQuery query);
}
