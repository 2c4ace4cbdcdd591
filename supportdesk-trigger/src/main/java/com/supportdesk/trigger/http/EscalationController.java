package com.supportdesk.trigger.http;

import com.supportdesk.api.dto.EscalationResultDTO;
import com.supportdesk.api.response.Response;
import com.supportdesk.trigger.application.common.TicketViewAssembler;
import com.supportdesk.trigger.service.EscalationOrchestratorService;
import com.supportdesk.trigger.service.EscalationOrchestratorService.EscalationOutcome;
import com.supportdesk.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 消息升级入口。由对话链路在消息落库（含情感分）后调用，结果始终以 0000 返回，失败信息放在 data 中。
 */
@RestController
@RequestMapping("/api/conversations")
public class EscalationController {

    private final EscalationOrchestratorService escalationOrchestratorService;

    public EscalationController(EscalationOrchestratorService escalationOrchestratorService) {
        this.escalationOrchestratorService = escalationOrchestratorService;
    }

    @PostMapping("/{conversationId}/messages/{messageId}/escalation")
    public Response<EscalationResultDTO> escalate(@PathVariable("conversationId") Long conversationId,
                                                  @PathVariable("messageId") Long messageId) {
        EscalationOutcome outcome = escalationOrchestratorService.process(conversationId, messageId);
        return Response.<EscalationResultDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(TicketViewAssembler.toEscalationResultDTO(outcome))
                .build();
    }
}
