package com.supportdesk.infrastructure.repository.conversation;

import com.supportdesk.domain.conversation.adapter.repository.IMessageRepository;
import com.supportdesk.domain.conversation.model.entity.MessageEntity;
import com.supportdesk.infrastructure.dao.MessageDao;
import com.supportdesk.infrastructure.dao.po.MessagePO;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 消息仓储实现类（只读）。
 */
@Repository
public class MessageRepositoryImpl implements IMessageRepository {

    private final MessageDao messageDao;

    public MessageRepositoryImpl(MessageDao messageDao) {
        this.messageDao = messageDao;
    }

    @Override
    public MessageEntity findById(Long id) {
        return id == null ? null : toEntity(messageDao.selectById(id));
    }

    @Override
    public List<MessageEntity> findRecentUpTo(Long conversationId, Long uptoMessageId, int limit) {
        if (conversationId == null || limit <= 0) {
            return Collections.emptyList();
        }
        List<MessagePO> messages = messageDao.selectRecentUpTo(conversationId, uptoMessageId, limit);
        if (messages == null || messages.isEmpty()) {
            return Collections.emptyList();
        }
        return messages.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private MessageEntity toEntity(MessagePO po) {
        if (po == null) {
            return null;
        }
        MessageEntity entity = new MessageEntity();
        entity.setId(po.getId());
        entity.setConversationId(po.getConversationId());
        entity.setContent(po.getContent());
        entity.setSentimentScore(po.getSentimentScore());
        entity.setSentimentLabel(po.getSentimentLabel());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
