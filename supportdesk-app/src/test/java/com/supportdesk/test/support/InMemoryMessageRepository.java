package com.supportdesk.test.support;

import com.supportdesk.domain.conversation.adapter.repository.IMessageRepository;
import com.supportdesk.domain.conversation.model.entity.MessageEntity;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存消息仓储。
 */
public class InMemoryMessageRepository implements IMessageRepository {

    private final Map<Long, MessageEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    public synchronized MessageEntity add(Long conversationId, String content, Double sentimentScore, LocalDateTime createdAt) {
        MessageEntity message = new MessageEntity();
        message.setId(nextId++);
        message.setConversationId(conversationId);
        message.setContent(content);
        message.setSentimentScore(sentimentScore);
        message.setCreatedAt(createdAt);
        store.put(message.getId(), message);
        return message;
    }

    @Override
    public synchronized MessageEntity findById(Long id) {
        return store.get(id);
    }

    @Override
    public synchronized List<MessageEntity> findRecentUpTo(Long conversationId, Long uptoMessageId, int limit) {
        return store.values().stream()
                .filter(message -> Objects.equals(message.getConversationId(), conversationId))
                .filter(message -> message.getId() <= uptoMessageId)
                .sorted(Comparator.comparing(MessageEntity::getCreatedAt).thenComparing(MessageEntity::getId).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
