package com.supportdesk.domain.conversation.adapter.repository;

import com.supportdesk.domain.conversation.model.entity.ConversationEntity;

/**
 * 会话仓储接口
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public interface IConversationRepository {

    /**
     * 根据 ID 查询
     */
    ConversationEntity findById(Long id);

    /**
     * 在当前事务内锁定会话行（SELECT ... FOR UPDATE），用于串行化同一会话的建单。
     * 会话不存在时返回 null。
     */
    ConversationEntity lockById(Long id);

    /**
     * 更新状态
     */
    boolean updateStatus(ConversationEntity entity);
}
