package com.supportdesk.domain.conversation.adapter.repository;

import com.supportdesk.domain.conversation.model.entity.MessageEntity;

import java.util.List;

/**
 * 消息仓储接口
 */
public interface IMessageRepository {

    MessageEntity findById(Long id);

    /**
     * 查询会话中截止到指定消息（含）的最近 limit 条消息，按创建时间倒序。
     */
    List<MessageEntity> findRecentUpTo(Long conversationId, Long uptoMessageId, int limit);
}
