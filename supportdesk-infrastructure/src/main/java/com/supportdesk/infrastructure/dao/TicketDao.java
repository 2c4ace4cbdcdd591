package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.AgentOpenTicketCountPO;
import com.supportdesk.infrastructure.dao.po.TicketPO;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 工单 DAO
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Mapper
public interface TicketDao {

    /**
     * 插入工单
     */
    int insert(TicketPO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(TicketPO po);

    TicketPO selectById(@Param("id") Long id);

    TicketPO selectLatestOpenByConversationSince(@Param("conversationId") Long conversationId,
                                                 @Param("createdSince") LocalDateTime createdSince);

    List<TicketPO> selectSlaBreachCandidates(@Param("now") LocalDateTime now,
                                             @Param("limit") Integer limit);

    List<AgentOpenTicketCountPO> countOpenByAssignees(@Param("agentIds") Collection<Long> agentIds);

    List<TicketPO> selectByQuery(@Param("status") TicketStatusEnum status,
                                 @Param("priority") TicketPriorityEnum priority,
                                 @Param("offset") Integer offset,
                                 @Param("limit") Integer limit);
}
