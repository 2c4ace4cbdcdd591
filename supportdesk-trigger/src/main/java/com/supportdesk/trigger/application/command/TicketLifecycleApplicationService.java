package com.supportdesk.trigger.application.command;

import com.google.common.util.concurrent.Striped;
import com.supportdesk.domain.conversation.adapter.repository.IConversationRepository;
import com.supportdesk.domain.conversation.adapter.repository.IMessageRepository;
import com.supportdesk.domain.conversation.model.entity.ConversationEntity;
import com.supportdesk.domain.conversation.model.entity.MessageEntity;
import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.domain.ticket.service.TicketTransitionDomainService;
import com.supportdesk.types.common.Constants;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.enums.TicketEventTypeEnum;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import com.supportdesk.types.exception.AppException;
import com.supportdesk.types.exception.ConsistencyConflictException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * 工单生命周期写用例：同一会话内的“查询 OPEN 工单 -> 复用或新建”必须线性化。
 * <p>
 * 进程内按会话分段加锁，事务内再对会话行加 FOR UPDATE 锁，覆盖多实例部署。
 * 检测到并发冲突（乐观锁版本不匹配、锁获取失败、唯一键冲突）时基于最新数据重试，
 * 重试耗尽后抛出 {@link ConsistencyConflictException}。
 * </p>
 */
@Slf4j
@Service
public class TicketLifecycleApplicationService {

    private static final Logger AUDIT = LoggerFactory.getLogger(Constants.AUDIT_LOGGER);

    private final ITicketRepository ticketRepository;
    private final ITicketEventRepository ticketEventRepository;
    private final IConversationRepository conversationRepository;
    private final IMessageRepository messageRepository;
    private final TicketTransitionDomainService ticketTransitionDomainService;
    private final TransactionOperations transactionOperations;
    private final Clock clock;
    private final Duration repeatWindow;
    private final int maxRetries;
    private final Striped<Lock> conversationLocks;
    private final Counter createdCounter;
    private final Counter reusedCounter;
    private final Counter conflictCounter;

    public TicketLifecycleApplicationService(ITicketRepository ticketRepository,
                                             ITicketEventRepository ticketEventRepository,
                                             IConversationRepository conversationRepository,
                                             IMessageRepository messageRepository,
                                             TicketTransitionDomainService ticketTransitionDomainService,
                                             TransactionOperations transactionOperations,
                                             Clock clock,
                                             @Value("${escalation.repeat-window-hours:3}") long repeatWindowHours,
                                             @Value("${ticket.lock.max-retries:1}") int maxRetries,
                                             @Value("${ticket.lock.stripes:64}") int lockStripes) {
        this.ticketRepository = ticketRepository;
        this.ticketEventRepository = ticketEventRepository;
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.ticketTransitionDomainService = ticketTransitionDomainService;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
        this.repeatWindow = Duration.ofHours(repeatWindowHours > 0 ? repeatWindowHours : 3);
        this.maxRetries = maxRetries >= 0 ? maxRetries : 1;
        this.conversationLocks = Striped.lazyWeakLock(lockStripes > 0 ? lockStripes : 64);
        this.createdCounter = Counter.builder("supportdesk.ticket.created.total").register(Metrics.globalRegistry);
        this.reusedCounter = Counter.builder("supportdesk.ticket.reused.total").register(Metrics.globalRegistry);
        this.conflictCounter = Counter.builder("supportdesk.ticket.conflict.total").register(Metrics.globalRegistry);
    }

    public LifecycleResult evaluateAndEscalate(Long conversationId,
                                               Long messageId,
                                               TicketPriorityEnum priority,
                                               String reason) {
        return evaluateAndEscalate(conversationId, messageId, priority, reason, repeatWindow);
    }

    /**
     * 复用窗口内的 OPEN 工单（优先级只升不降、原因追加），否则新建 OPEN 工单。
     * 每次新建/复用都在同一事务内写入一条工单事件。
     */
    public LifecycleResult evaluateAndEscalate(Long conversationId,
                                               Long messageId,
                                               TicketPriorityEnum priority,
                                               String reason,
                                               Duration window) {
        if (conversationId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "conversationId is required");
        }
        if (priority == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "priority is required");
        }
        Duration effectiveWindow = window == null || window.isNegative() || window.isZero() ? repeatWindow : window;

        Lock lock = conversationLocks.get(conversationId);
        lock.lock();
        try {
            RuntimeException lastConflict = null;
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    LifecycleResult result = transactionOperations.execute(
                            status -> escalateInTransaction(conversationId, messageId, priority, reason, effectiveWindow));
                    if (attempt > 0) {
                        log.info("Ticket escalation succeeded after retry. conversationId={}, attempt={}",
                                conversationId, attempt + 1);
                    }
                    return result;
                } catch (ConcurrencyFailureException | DuplicateKeyException ex) {
                    lastConflict = ex;
                    conflictCounter.increment();
                    log.warn("Ticket escalation conflict. conversationId={}, attempt={}, error={}",
                            conversationId, attempt + 1, ex.getMessage());
                }
            }
            throw new ConsistencyConflictException(conversationId,
                    "Concurrent ticket write for conversation " + conversationId + ", retry later", lastConflict);
        } finally {
            lock.unlock();
        }
    }

    private LifecycleResult escalateInTransaction(Long conversationId,
                                                  Long messageId,
                                                  TicketPriorityEnum priority,
                                                  String reason,
                                                  Duration window) {
        ConversationEntity conversation = conversationRepository.lockById(conversationId);
        if (conversation == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Conversation not found: " + conversationId);
        }
        if (messageId != null) {
            MessageEntity message = messageRepository.findById(messageId);
            if (message == null) {
                throw new AppException(ResponseCode.NOT_FOUND, "Message not found: " + messageId);
            }
            if (!Objects.equals(message.getConversationId(), conversationId)) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                        "Message " + messageId + " does not belong to conversation " + conversationId);
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        TicketEntity existing = ticketRepository.findLatestOpenByConversationSince(conversationId, now.minus(window));
        if (existing != null) {
            TicketPriorityEnum before = existing.getPriority();
            TicketEventEntity event = ticketTransitionDomainService.reuse(existing, priority, reason, messageId, now);
            ticketRepository.update(existing);
            ticketEventRepository.save(event);
            reusedCounter.increment();
            AUDIT.info("TICKET_REUSED ticketId={}, conversationId={}, messageId={}, priorityBefore={}, priorityAfter={}",
                    existing.getId(), conversationId, messageId, before, existing.getPriority());
            return LifecycleResult.reused(existing);
        }

        TicketEntity ticket = TicketEntity.open(conversationId, messageId, priority,
                ticketTransitionDomainService.mergeReason(null, reason), now);
        ticketRepository.save(ticket);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("messageId", messageId);
        detail.put("reason", ticket.getReason());
        ticketEventRepository.save(TicketEventEntity.of(ticket.getId(), TicketEventTypeEnum.CREATED,
                null, priority.getCode(), detail, now));
        if (conversation.markEscalated(now)) {
            conversationRepository.updateStatus(conversation);
        }
        createdCounter.increment();
        AUDIT.info("TICKET_CREATED ticketId={}, conversationId={}, messageId={}, priority={}, reason={}",
                ticket.getId(), conversationId, messageId, priority, ticket.getReason());
        return LifecycleResult.created(ticket);
    }

    /**
     * 重新打开已解决的工单。与新建/复用共用会话锁，复用窗口内会话已有其他 OPEN 工单时拒绝。
     */
    public TicketEntity reopen(Long ticketId) {
        if (ticketId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "ticketId is required");
        }
        TicketEntity snapshot = ticketRepository.findById(ticketId);
        if (snapshot == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Ticket not found: " + ticketId);
        }
        Long conversationId = snapshot.getConversationId();
        Lock lock = conversationLocks.get(conversationId);
        lock.lock();
        try {
            return transactionOperations.execute(status -> reopenInTransaction(ticketId, conversationId));
        } catch (ConcurrencyFailureException ex) {
            conflictCounter.increment();
            throw new ConsistencyConflictException(conversationId,
                    "Ticket " + ticketId + " was modified concurrently, retry later", ex);
        } finally {
            lock.unlock();
        }
    }

    private TicketEntity reopenInTransaction(Long ticketId, Long conversationId) {
        conversationRepository.lockById(conversationId);
        TicketEntity ticket = ticketRepository.findById(ticketId);
        if (ticket == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Ticket not found: " + ticketId);
        }
        if (ticket.getStatus() == TicketStatusEnum.OPEN) {
            return ticket;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        TicketEntity open = ticketRepository.findLatestOpenByConversationSince(conversationId, now.minus(repeatWindow));
        if (open != null && !Objects.equals(open.getId(), ticketId)) {
            throw new AppException(ResponseCode.ILLEGAL_STATE,
                    "Conversation " + conversationId + " already has open ticket " + open.getId());
        }
        TicketEventEntity event;
        try {
            event = ticketTransitionDomainService.transit(ticket, TicketStatusEnum.OPEN, now);
        } catch (IllegalStateException ex) {
            throw new AppException(ResponseCode.ILLEGAL_STATE, ex.getMessage());
        }
        ticketRepository.update(ticket);
        ticketEventRepository.save(event);
        AUDIT.info("TICKET_REOPENED ticketId={}, conversationId={}, from={}", ticketId, conversationId, event.getOldValue());
        return ticket;
    }

    public Duration getRepeatWindow() {
        return repeatWindow;
    }

    public record LifecycleResult(TicketEntity ticket, boolean created) {
        public static LifecycleResult created(TicketEntity ticket) {
            return new LifecycleResult(ticket, true);
        }

        public static LifecycleResult reused(TicketEntity ticket) {
            return new LifecycleResult(ticket, false);
        }
    }
}
