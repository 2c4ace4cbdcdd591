package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.TicketEventPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 工单事件 DAO（只追加）。
 */
@Mapper
public interface TicketEventDao {

    int insert(TicketEventPO po);

    List<TicketEventPO> selectByTicketId(@Param("ticketId") Long ticketId);
}
