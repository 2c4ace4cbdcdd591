package com.supportdesk.infrastructure.repository.ticket;

import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.valobj.AgentOpenTicketCount;
import com.supportdesk.domain.ticket.model.valobj.TicketQuery;
import com.supportdesk.infrastructure.dao.TicketDao;
import com.supportdesk.infrastructure.dao.po.AgentOpenTicketCountPO;
import com.supportdesk.infrastructure.dao.po.TicketPO;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工单仓储实现类。
 * <p>
 * 负责工单的持久化操作，包括：
 * <ul>
 *   <li>工单的新增与乐观锁更新</li>
 *   <li>会话去重查询、SLA 违约扫描、坐席负载统计</li>
 *   <li>Entity与PO之间的相互转换</li>
 * </ul>
 * </p>
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Repository
public class TicketRepositoryImpl implements ITicketRepository {

    private final TicketDao ticketDao;

    public TicketRepositoryImpl(TicketDao ticketDao) {
        this.ticketDao = ticketDao;
    }

    @Override
    public TicketEntity save(TicketEntity entity) {
        entity.validate();
        TicketPO po = toPO(entity);
        if (po.getVersion() == null) {
            po.setVersion(0);
        }
        ticketDao.insert(po);
        entity.setId(po.getId());
        entity.setVersion(po.getVersion());
        return toEntity(po);
    }

    @Override
    public TicketEntity update(TicketEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for Ticket update: " + entity.getId());
        }
        TicketPO po = toPO(entity);
        int affected = ticketDao.updateWithVersion(po);
        if (affected == 0) {
            throw new OptimisticLockingFailureException("Optimistic lock failed for Ticket: " + entity.getId());
        }
        Integer newVersion = oldVersion + 1;
        entity.setVersion(newVersion);
        po.setVersion(newVersion);
        return toEntity(po);
    }

    @Override
    public TicketEntity findById(Long id) {
        return id == null ? null : toEntity(ticketDao.selectById(id));
    }

    @Override
    public TicketEntity findLatestOpenByConversationSince(Long conversationId, LocalDateTime createdSince) {
        if (conversationId == null || createdSince == null) {
            return null;
        }
        return toEntity(ticketDao.selectLatestOpenByConversationSince(conversationId, createdSince));
    }

    @Override
    public List<TicketEntity> findSlaBreachCandidates(LocalDateTime now, int limit) {
        if (now == null || limit <= 0) {
            return Collections.emptyList();
        }
        return ticketDao.selectSlaBreachCandidates(now, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentOpenTicketCount> countOpenByAssignees(Collection<Long> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<AgentOpenTicketCountPO> rows = ticketDao.countOpenByAssignees(agentIds);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream()
                .map(row -> new AgentOpenTicketCount(row.getAgentId(),
                        row.getOpenTicketCount() == null ? 0L : row.getOpenTicketCount()))
                .collect(Collectors.toList());
    }

    @Override
    public List<TicketEntity> findByQuery(TicketQuery query) {
        if (query == null || query.limit() <= 0) {
            return Collections.emptyList();
        }
        int safeOffset = Math.max(0, query.offset());
        return ticketDao.selectByQuery(query.status(), query.priority(), safeOffset, query.limit()).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO 转换为 Entity
     */
    private TicketEntity toEntity(TicketPO po) {
        if (po == null) {
            return null;
        }
        TicketEntity entity = new TicketEntity();
        entity.setId(po.getId());
        entity.setConversationId(po.getConversationId());
        entity.setLastMessageId(po.getLastMessageId());
        entity.setStatus(po.getStatus());
        entity.setPriority(po.getPriority());
        entity.setReason(po.getReason());
        entity.setDepartmentId(po.getDepartmentId());
        entity.setAssignedAgentId(po.getAssignedAgentId());
        entity.setRoutingMethod(po.getRoutingMethod());
        entity.setAiConfidence(po.getAiConfidence());
        entity.setAiPredictedDepartment(po.getAiPredictedDepartment());
        entity.setSlaDueAt(po.getSlaDueAt());
        entity.setResolutionDueAt(po.getResolutionDueAt());
        entity.setSlaBreached(po.getSlaBreached());
        entity.setEscalationLevel(po.getEscalationLevel());
        entity.setReassignedCount(po.getReassignedCount());
        entity.setAssignedAt(po.getAssignedAt());
        entity.setFirstResponseAt(po.getFirstResponseAt());
        entity.setClosedAt(po.getClosedAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private TicketPO toPO(TicketEntity entity) {
        return TicketPO.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .lastMessageId(entity.getLastMessageId())
                .status(entity.getStatus())
                .priority(entity.getPriority())
                .reason(entity.getReason())
                .departmentId(entity.getDepartmentId())
                .assignedAgentId(entity.getAssignedAgentId())
                .routingMethod(entity.getRoutingMethod())
                .aiConfidence(entity.getAiConfidence())
                .aiPredictedDepartment(entity.getAiPredictedDepartment())
                .slaDueAt(entity.getSlaDueAt())
                .resolutionDueAt(entity.getResolutionDueAt())
                .slaBreached(entity.getSlaBreached())
                .escalationLevel(entity.getEscalationLevel())
                .reassignedCount(entity.getReassignedCount())
                .assignedAt(entity.getAssignedAt())
                .firstResponseAt(entity.getFirstResponseAt())
                .closedAt(entity.getClosedAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
