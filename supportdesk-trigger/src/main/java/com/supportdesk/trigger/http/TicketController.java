package com.supportdesk.trigger.http;

import com.supportdesk.api.dto.TicketDTO;
import com.supportdesk.api.dto.TicketEventDTO;
import com.supportdesk.api.response.Response;
import com.supportdesk.trigger.application.query.TicketQueryService;
import com.supportdesk.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 工单查询 API。
 */
@RestController
@RequestMapping("/api/tickets")
public class TicketController {

    private final TicketQueryService ticketQueryService;

    public TicketController(TicketQueryService ticketQueryService) {
        this.ticketQueryService = ticketQueryService;
    }

    @GetMapping("/{id}")
    public Response<TicketDTO> getTicket(@PathVariable("id") Long ticketId) {
        return success(ticketQueryService.getTicket(ticketId));
    }

    @GetMapping
    public Response<List<TicketDTO>> listTickets(@RequestParam(value = "status", required = false) String status,
                                                 @RequestParam(value = "priority", required = false) String priority,
                                                 @RequestParam(value = "page", defaultValue = "1") int page,
                                                 @RequestParam(value = "size", defaultValue = "20") int size) {
        return success(ticketQueryService.listTickets(status, priority, page, size));
    }

    @GetMapping("/{id}/events")
    public Response<List<TicketEventDTO>> listEvents(@PathVariable("id") Long ticketId) {
        return success(ticketQueryService.listEvents(ticketId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
