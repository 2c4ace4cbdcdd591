package com.supportdesk.infrastructure.repository.ticket;

import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.infrastructure.dao.TicketEventDao;
import com.supportdesk.infrastructure.dao.po.TicketEventPO;
import com.supportdesk.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工单事件仓储实现。
 */
@Repository
public class TicketEventRepositoryImpl implements ITicketEventRepository {

    private final TicketEventDao ticketEventDao;
    private final JsonCodec jsonCodec;

    public TicketEventRepositoryImpl(TicketEventDao ticketEventDao, JsonCodec jsonCodec) {
        this.ticketEventDao = ticketEventDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public TicketEventEntity save(TicketEventEntity entity) {
        entity.validate();
        TicketEventPO po = toPO(entity);
        ticketEventDao.insert(po);
        entity.setId(po.getId());
        return toEntity(po);
    }

    @Override
    public List<TicketEventEntity> findByTicketId(Long ticketId) {
        if (ticketId == null) {
            return Collections.emptyList();
        }
        List<TicketEventPO> events = ticketEventDao.selectByTicketId(ticketId);
        if (events == null || events.isEmpty()) {
            return Collections.emptyList();
        }
        return events.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private TicketEventEntity toEntity(TicketEventPO po) {
        TicketEventEntity entity = new TicketEventEntity();
        entity.setId(po.getId());
        entity.setTicketId(po.getTicketId());
        entity.setEventType(po.getEventType());
        entity.setOldValue(po.getOldValue());
        entity.setNewValue(po.getNewValue());
        entity.setCreatedAt(po.getCreatedAt());
        if (po.getDetail() != null) {
            entity.setDetail(jsonCodec.readMap(po.getDetail()));
        }
        return entity;
    }

    private TicketEventPO toPO(TicketEventEntity entity) {
        TicketEventPO po = TicketEventPO.builder()
                .id(entity.getId())
                .ticketId(entity.getTicketId())
                .eventType(entity.getEventType())
                .oldValue(entity.getOldValue())
                .newValue(entity.getNewValue())
                .createdAt(entity.getCreatedAt())
                .build();
        if (entity.getDetail() != null && !entity.getDetail().isEmpty()) {
            po.setDetail(jsonCodec.writeValue(entity.getDetail()));
        }
        return po;
    }
}
