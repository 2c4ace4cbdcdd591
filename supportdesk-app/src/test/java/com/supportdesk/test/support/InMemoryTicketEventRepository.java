package com.supportdesk.test.support;

import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.types.enums.TicketEventTypeEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存工单事件仓储（只追加）。
 */
public class InMemoryTicketEventRepository implements ITicketEventRepository {

    private final List<TicketEventEntity> events = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized TicketEventEntity save(TicketEventEntity event) {
        event.validate();
        event.setId(nextId++);
        events.add(event);
        return event;
    }

    @Override
    public synchronized List<TicketEventEntity> findByTicketId(Long ticketId) {
        return events.stream()
                .filter(event -> Objects.equals(event.getTicketId(), ticketId))
                .collect(Collectors.toList());
    }

    public synchronized List<TicketEventTypeEnum> typesOf(Long ticketId) {
        return findByTicketId(ticketId).stream().map(TicketEventEntity::getEventType).collect(Collectors.toList());
    }

    public synchronized int size() {
        return events.size();
    }
}
