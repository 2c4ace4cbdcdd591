package com.supportdesk.trigger.http;

import com.supportdesk.api.dto.TicketAssignRequestDTO;
import com.supportdesk.api.dto.TicketDTO;
import com.supportdesk.api.response.Response;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.trigger.application.command.TicketActionCommandService;
import com.supportdesk.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.supportdesk.trigger.application.common.TicketViewAssembler.toTicketDTO;

/**
 * 工单状态流转与改派 API。
 * <p>
 * 状态非法流转返回 0007，并发写冲突返回 0006，由 {@link GlobalApiExceptionHandler} 统一处理。
 * </p>
 */
@RestController
@RequestMapping("/api/tickets")
public class TicketActionController {

    private final TicketActionCommandService ticketActionCommandService;

    public TicketActionController(TicketActionCommandService ticketActionCommandService) {
        this.ticketActionCommandService = ticketActionCommandService;
    }

    @PostMapping("/{id}/start")
    public Response<TicketDTO> start(@PathVariable("id") Long ticketId) {
        return success(ticketActionCommandService.start(ticketId));
    }

    @PostMapping("/{id}/resolve")
    public Response<TicketDTO> resolve(@PathVariable("id") Long ticketId) {
        return success(ticketActionCommandService.resolve(ticketId));
    }

    @PostMapping("/{id}/close")
    public Response<TicketDTO> close(@PathVariable("id") Long ticketId) {
        return success(ticketActionCommandService.close(ticketId));
    }

    @PostMapping("/{id}/reopen")
    public Response<TicketDTO> reopen(@PathVariable("id") Long ticketId) {
        return success(ticketActionCommandService.reopen(ticketId));
    }

    @PostMapping("/{id}/assign")
    public Response<TicketDTO> assign(@PathVariable("id") Long ticketId,
                                      @RequestBody(required = false) TicketAssignRequestDTO request) {
        Long agentId = request == null ? null : request.getAgentId();
        return success(ticketActionCommandService.assign(ticketId, agentId));
    }

    private Response<TicketDTO> success(TicketEntity ticket) {
        return Response.<TicketDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(toTicketDTO(ticket))
                .build();
    }
}
