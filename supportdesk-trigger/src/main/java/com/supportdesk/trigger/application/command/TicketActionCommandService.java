package com.supportdesk.trigger.application.command;

import com.supportdesk.domain.assignment.adapter.repository.ISupportAgentRepository;
import com.supportdesk.domain.assignment.model.entity.SupportAgentEntity;
import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.domain.ticket.service.TicketTransitionDomainService;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.enums.TicketEventTypeEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import com.supportdesk.types.exception.AppException;
import com.supportdesk.types.exception.ConsistencyConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 工单人工操作写用例：状态流转与改派。
 */
@Slf4j
@Service
public class TicketActionCommandService {

    private final ITicketRepository ticketRepository;
    private final ITicketEventRepository ticketEventRepository;
    private final ISupportAgentRepository supportAgentRepository;
    private final TicketTransitionDomainService ticketTransitionDomainService;
    private final AgentAssignmentApplicationService agentAssignmentApplicationService;
    private final TicketLifecycleApplicationService ticketLifecycleApplicationService;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    public TicketActionCommandService(ITicketRepository ticketRepository,
                                      ITicketEventRepository ticketEventRepository,
                                      ISupportAgentRepository supportAgentRepository,
                                      TicketTransitionDomainService ticketTransitionDomainService,
                                      AgentAssignmentApplicationService agentAssignmentApplicationService,
                                      TicketLifecycleApplicationService ticketLifecycleApplicationService,
                                      TransactionOperations transactionOperations,
                                      Clock clock) {
        this.ticketRepository = ticketRepository;
        this.ticketEventRepository = ticketEventRepository;
        this.supportAgentRepository = supportAgentRepository;
        this.ticketTransitionDomainService = ticketTransitionDomainService;
        this.agentAssignmentApplicationService = agentAssignmentApplicationService;
        this.ticketLifecycleApplicationService = ticketLifecycleApplicationService;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
    }

    public TicketEntity start(Long ticketId) {
        return transit(ticketId, TicketStatusEnum.IN_PROGRESS);
    }

    public TicketEntity resolve(Long ticketId) {
        return transit(ticketId, TicketStatusEnum.RESOLVED);
    }

    public TicketEntity close(Long ticketId) {
        return transit(ticketId, TicketStatusEnum.CLOSED);
    }

    /**
     * 回到 OPEN 会影响“同一会话一个 OPEN 工单”的约束，交由生命周期服务在会话锁内处理。
     */
    public TicketEntity reopen(Long ticketId) {
        return ticketLifecycleApplicationService.reopen(ticketId);
    }

    /**
     * 状态流转，目标状态与当前一致时幂等返回。
     */
    public TicketEntity transit(Long ticketId, TicketStatusEnum target) {
        if (target == TicketStatusEnum.OPEN) {
            return reopen(ticketId);
        }
        return executeWrite(ticketId, () -> {
            TicketEntity ticket = loadTicket(ticketId);
            if (ticket.getStatus() == target) {
                return ticket;
            }
            TicketEventEntity event;
            try {
                event = ticketTransitionDomainService.transit(ticket, target, LocalDateTime.now(clock));
            } catch (IllegalStateException ex) {
                throw new AppException(ResponseCode.ILLEGAL_STATE, ex.getMessage());
            }
            ticketRepository.update(ticket);
            ticketEventRepository.save(event);
            log.info("Ticket status changed. ticketId={}, from={}, to={}", ticketId, event.getOldValue(), target);
            return ticket;
        });
    }

    /**
     * 改派。agentId 为空时按最少负载在工单部门内重新挑选（排除当前坐席）。
     */
    public TicketEntity assign(Long ticketId, Long agentId) {
        return executeWrite(ticketId, () -> {
            TicketEntity ticket = loadTicket(ticketId);
            if (ticket.getStatus() == TicketStatusEnum.CLOSED) {
                throw new AppException(ResponseCode.ILLEGAL_STATE, "Closed tickets cannot be assigned: " + ticketId);
            }
            SupportAgentEntity agent = agentId == null
                    ? agentAssignmentApplicationService.selectAgent(ticket.getDepartmentId(), ticket.getAssignedAgentId())
                    : loadAssignableAgent(agentId, ticket.getDepartmentId());
            if (agent == null) {
                throw new AppException(ResponseCode.ILLEGAL_STATE, "No available agent for ticket: " + ticketId);
            }
            if (Objects.equals(agent.getId(), ticket.getAssignedAgentId())) {
                return ticket;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            Long before = ticket.getAssignedAgentId();
            ticket.assignTo(agent.getId(), now);
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("manual", true);
            detail.put("reassignedCount", ticket.reassignedCountValue());
            ticketRepository.update(ticket);
            ticketEventRepository.save(TicketEventEntity.of(ticketId, TicketEventTypeEnum.ASSIGNED,
                    before, agent.getId(), detail, now));
            log.info("Ticket assigned. ticketId={}, from={}, to={}", ticketId, before, agent.getId());
            return ticket;
        });
    }

    private SupportAgentEntity loadAssignableAgent(Long agentId, Long departmentId) {
        SupportAgentEntity agent = supportAgentRepository.findById(agentId);
        if (agent == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Agent not found: " + agentId);
        }
        if (!agent.isAssignableTo(departmentId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "Agent " + agentId + " is inactive or outside department " + departmentId);
        }
        return agent;
    }

    private TicketEntity loadTicket(Long ticketId) {
        if (ticketId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "ticketId is required");
        }
        TicketEntity ticket = ticketRepository.findById(ticketId);
        if (ticket == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Ticket not found: " + ticketId);
        }
        return ticket;
    }

    private TicketEntity executeWrite(Long ticketId, TicketWrite write) {
        try {
            return transactionOperations.execute(status -> write.apply());
        } catch (ConcurrencyFailureException ex) {
            TicketEntity current = ticketRepository.findById(ticketId);
            throw new ConsistencyConflictException(current == null ? null : current.getConversationId(),
                    "Ticket " + ticketId + " was modified concurrently, retry later", ex);
        }
    }

    @FunctionalInterface
    private interface TicketWrite {
        TicketEntity apply();
    }
}
