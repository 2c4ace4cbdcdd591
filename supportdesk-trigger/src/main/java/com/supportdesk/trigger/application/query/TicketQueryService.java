package com.supportdesk.trigger.application.query;

import com.supportdesk.api.dto.TicketDTO;
import com.supportdesk.api.dto.TicketEventDTO;
import com.supportdesk.domain.ticket.adapter.repository.ITicketEventRepository;
import com.supportdesk.domain.ticket.adapter.repository.ITicketRepository;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.valobj.TicketQuery;
import com.supportdesk.trigger.application.common.TicketViewAssembler;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.enums.TicketPriorityEnum;
import com.supportdesk.types.enums.TicketStatusEnum;
import com.supportdesk.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 工单查询读用例。
 */
@Service
public class TicketQueryService {

    private static final int MAX_PAGE_SIZE = 200;

    private final ITicketRepository ticketRepository;
    private final ITicketEventRepository ticketEventRepository;

    public TicketQueryService(ITicketRepository ticketRepository, ITicketEventRepository ticketEventRepository) {
        this.ticketRepository = ticketRepository;
        this.ticketEventRepository = ticketEventRepository;
    }

    public TicketDTO getTicket(Long ticketId) {
        return TicketViewAssembler.toTicketDTO(requireTicket(ticketId));
    }

    public List<TicketDTO> listTickets(String status, String priority, int page, int size) {
        TicketStatusEnum statusFilter = StringUtils.isBlank(status) ? null : TicketStatusEnum.fromCode(status);
        TicketPriorityEnum priorityFilter = StringUtils.isBlank(priority) ? null : TicketPriorityEnum.fromCode(priority);
        int safeSize = size <= 0 ? 20 : Math.min(size, MAX_PAGE_SIZE);
        int safePage = Math.max(page, 1);
        TicketQuery query = new TicketQuery(statusFilter, priorityFilter, (safePage - 1) * safeSize, safeSize);
        return ticketRepository.findByQuery(query).stream()
                .map(TicketViewAssembler::toTicketDTO)
                .collect(Collectors.toList());
    }

    public List<TicketEventDTO> listEvents(Long ticketId) {
        requireTicket(ticketId);
        return ticketEventRepository.findByTicketId(ticketId).stream()
                .map(TicketViewAssembler::toEventDTO)
                .collect(Collectors.toList());
    }

    private TicketEntity requireTicket(Long ticketId) {
        TicketEntity ticket = ticketId == null ? null : ticketRepository.findById(ticketId);
        if (ticket == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Ticket not found: " + ticketId);
        }
        return ticket;
    }
}
