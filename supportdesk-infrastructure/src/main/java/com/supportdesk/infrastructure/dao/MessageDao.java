package com.supportdesk.infrastructure.dao;

import com.supportdesk.infrastructure.dao.po.MessagePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 消息 DAO
 */
@Mapper
public interface MessageDao {

    MessagePO selectById(@Param("id") Long id);

    List<MessagePO> selectRecentUpTo(@Param("conversationId") Long conversationId,
                                     @Param("uptoMessageId") Long uptoMessageId,
                                     @Param("limit") Integer limit);
}
