package com.supportdesk.infrastructure.repository.conversation;

import com.supportdesk.domain.conversation.adapter.repository.IConversationRepository;
import com.supportdesk.domain.conversation.model.entity.ConversationEntity;
import com.supportdesk.infrastructure.dao.ConversationDao;
import com.supportdesk.infrastructure.dao.po.ConversationPO;
import org.springframework.stereotype.Repository;

/**
 * 会话仓储实现类。
 */
@Repository
public class ConversationRepositoryImpl implements IConversationRepository {

    private final ConversationDao conversationDao;

    public ConversationRepositoryImpl(ConversationDao conversationDao) {
        this.conversationDao = conversationDao;
    }

    @Override
    public ConversationEntity findById(Long id) {
        return id == null ? null : toEntity(conversationDao.selectById(id));
    }

    @Override
    public ConversationEntity lockById(Long id) {
        return id == null ? null : toEntity(conversationDao.selectByIdForUpdate(id));
    }

    @Override
    public boolean updateStatus(ConversationEntity entity) {
        if (entity == null || entity.getId() == null || entity.getStatus() == null) {
            return false;
        }
        ConversationPO po = ConversationPO.builder()
                .id(entity.getId())
                .status(entity.getStatus())
                .updatedAt(entity.getUpdatedAt())
                .build();
        return conversationDao.updateStatus(po) > 0;
    }

    private ConversationEntity toEntity(ConversationPO po) {
        if (po == null) {
            return null;
        }
        ConversationEntity entity = new ConversationEntity();
        entity.setId(po.getId());
        entity.setDepartmentId(po.getDepartmentId());
        entity.setStatus(po.getStatus());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
