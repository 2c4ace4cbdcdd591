package com.supportdesk.test.support;

import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.valobj.AgentOpenTicketCount;
import com.supportdesk.domain.ticket.model.valobj.TicketQuery;
import com.supportdesk.types.enums.TicketStatusEnum;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 内存工单仓储：保存快照副本，按版本号做乐观锁校验，可注入一次性故障模拟并发冲突。
 */
public class InMemoryTicketRepository implements ITicketRepository {

    private final Map<Long, TicketEntity> store = new LinkedHashMap<>();
    private final Deque<RuntimeException> saveFailures = new ArrayDeque<>();
    private final Deque<RuntimeException> updateFailures = new ArrayDeque<>();
    private final AtomicInteger saveCalls = new AtomicInteger();
    private final AtomicInteger updateCalls = new AtomicInteger();
    private long nextId = 1;

    public synchronized void failNextSave(RuntimeException error) {
        saveFailures.add(error);
    }

    public synchronized void failNextUpdate(RuntimeException error) {
        updateFailures.add(error);
    }

    public int saveCalls() {
        return saveCalls.get();
    }

    public int updateCalls() {
        return updateCalls.get();
    }

    public synchronized List<TicketEntity> all() {
        return store.values().stream().map(InMemoryTicketRepository::copy).collect(Collectors.toList());
    }

    /**
     * 直接写入，绕过版本校验，用于准备测试数据。
     */
    public synchronized TicketEntity put(TicketEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        } else {
            nextId = Math.max(nextId, entity.getId() + 1);
        }
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized TicketEntity save(TicketEntity entity) {
        saveCalls.incrementAndGet();
        RuntimeException failure = saveFailures.poll();
        if (failure != null) {
            throw failure;
        }
        entity.validate();
        entity.setId(nextId++);
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        store.put(entity.getId(), copy(entity));
        return copy(entity);
    }

    @Override
    public synchronized TicketEntity update(TicketEntity entity) {
        updateCalls.incrementAndGet();
        RuntimeException failure = updateFailures.poll();
        if (failure != null) {
            throw failure;
        }
        entity.validate();
        TicketEntity current = store.get(entity.getId());
        if (current == null || !Objects.equals(current.getVersion(), entity.getVersion())) {
            throw new OptimisticLockingFailureException("Optimistic lock failed for Ticket: " + entity.getId());
        }
        entity.setVersion(entity.getVersion() + 1);
        store.put(entity.getId(), copy(entity));
        return copy(entity);
    }

    @Override
    public synchronized TicketEntity findById(Long id) {
        TicketEntity ticket = store.get(id);
        return ticket == null ? null : copy(ticket);
    }

    @Override
    public synchronized TicketEntity findLatestOpenByConversationSince(Long conversationId, LocalDateTime createdSince) {
        return store.values().stream()
                .filter(ticket -> Objects.equals(ticket.getConversationId(), conversationId))
                .filter(ticket -> ticket.getStatus() == TicketStatusEnum.OPEN)
                .filter(ticket -> !ticket.getCreatedAt().isBefore(createdSince))
                .max(Comparator.comparing(TicketEntity::getCreatedAt).thenComparing(TicketEntity::getId))
                .map(InMemoryTicketRepository::copy)
                .orElse(null);
    }

    @Override
    public synchronized List<TicketEntity> findSlaBreachCandidates(LocalDateTime now, int limit) {
        return store.values().stream()
                .filter(ticket -> ticket.isBreachCandidate(now))
                .sorted(Comparator.comparing(TicketEntity::getSlaDueAt).thenComparing(TicketEntity::getId))
                .limit(limit)
                .map(InMemoryTicketRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<AgentOpenTicketCount> countOpenByAssignees(Collection<Long> agentIds) {
        Map<Long, Long> counts = new LinkedHashMap<>();
        for (TicketEntity ticket : store.values()) {
            if (ticket.isOpen() && ticket.getAssignedAgentId() != null && agentIds.contains(ticket.getAssignedAgentId())) {
                counts.merge(ticket.getAssignedAgentId(), 1L, Long::sum);
            }
        }
        List<AgentOpenTicketCount> result = new ArrayList<>();
        counts.forEach((agentId, count) -> result.add(new AgentOpenTicketCount(agentId, count)));
        return result;
    }

    @Override
    public synchronized List<TicketEntity> findByQuery(TicketQuery query) {
        return store.values().stream()
                .filter(ticket -> query.status() == null || ticket.getStatus() == query.status())
                .filter(ticket -> query.priority() == null || ticket.getPriority() == query.priority())
                .sorted(Comparator.comparing(TicketEntity::getCreatedAt).thenComparing(TicketEntity::getId).reversed())
                .skip(query.offset())
                .limit(query.limit())
                .map(InMemoryTicketRepository::copy)
                .collect(Collectors.toList());
    }

    public static TicketEntity copy(TicketEntity source) {
        TicketEntity target = new TicketEntity();
        target.setId(source.getId());
        target.setConversationId(source.getConversationId());
        target.setLastMessageId(source.getLastMessageId());
        target.setStatus(source.getStatus());
        target.setPriority(source.getPriority());
        target.setReason(source.getReason());
        target.setDepartmentId(source.getDepartmentId());
        target.setAssignedAgentId(source.getAssignedAgentId());
        target.setRoutingMethod(source.getRoutingMethod());
        target.setAiConfidence(source.getAiConfidence());
        target.setAiPredictedDepartment(source.getAiPredictedDepartment());
        target.setSlaDueAt(source.getSlaDueAt());
        target.setResolutionDueAt(source.getResolutionDueAt());
        target.setSlaBreached(source.getSlaBreached());
        target.setEscalationLevel(source.getEscalationLevel());
        target.setReassignedCount(source.getReassignedCount());
        target.setAssignedAt(source.getAssignedAt());
        target.setFirstResponseAt(source.getFirstResponseAt());
        target.setClosedAt(source.getClosedAt());
        target.setVersion(source.getVersion());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
