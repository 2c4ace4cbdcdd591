package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.ConversationPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 会话 DAO
 */
@Mapper
public interface ConversationDao {

    ConversationPO selectById(@Param("id") Long id);

    /**
     * 行锁查询 (FOR UPDATE)，需在事务内调用
     */
    ConversationPO selectByIdForUpdate(@Param("id") Long id);

    int updateStatus(ConversationPO po);
}
