package com.supportdesk.trigger.application.common;

import com.supportdesk.api.dto.EscalationResultDTO;
import com.supportdesk.api.dto.TicketDTO;
import com.supportdesk.api.dto.TicketEventDTO;
import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.entity.TicketEventEntity;
import com.supportdesk.trigger.service.EscalationOrchestratorService.EscalationOutcome;

/**
 * 工单视图组装器。
 */
public final class TicketViewAssembler {

    private TicketViewAssembler() {
    }

    public static TicketDTO toTicketDTO(TicketEntity ticket) {
        if (ticket == null) {
            return null;
        }
        TicketDTO dto = new TicketDTO();
        dto.setId(ticket.getId());
        dto.setConversationId(ticket.getConversationId());
        dto.setStatus(ticket.getStatus() == null ? null : ticket.getStatus().getCode());
        dto.setPriority(ticket.getPriority() == null ? null : ticket.getPriority().getCode());
        dto.setDepartmentId(ticket.getDepartmentId());
        dto.setAssignedAgentId(ticket.getAssignedAgentId());
        dto.setRoutingMethod(ticket.getRoutingMethod() == null ? null : ticket.getRoutingMethod().name());
        dto.setAiConfidence(ticket.getAiConfidence());
        dto.setAiPredictedDepartment(ticket.getAiPredictedDepartment());
        dto.setReason(ticket.getReason());
        dto.setLastMessageId(ticket.getLastMessageId());
        dto.setSlaDueAt(ticket.getSlaDueAt());
        dto.setResolutionDueAt(ticket.getResolutionDueAt());
        dto.setSlaBreached(ticket.isSlaBreached());
        dto.setEscalationLevel(ticket.escalationLevelValue());
        dto.setReassignedCount(ticket.reassignedCountValue());
        dto.setAssignedAt(ticket.getAssignedAt());
        dto.setFirstResponseAt(ticket.getFirstResponseAt());
        dto.setClosedAt(ticket.getClosedAt());
        dto.setCreatedAt(ticket.getCreatedAt());
        dto.setUpdatedAt(ticket.getUpdatedAt());
        return dto;
    }

    public static TicketEventDTO toEventDTO(TicketEventEntity event) {
        if (event == null) {
            return null;
        }
        TicketEventDTO dto = new TicketEventDTO();
        dto.setId(event.getId());
        dto.setTicketId(event.getTicketId());
        dto.setEventType(event.getEventType() == null ? null : event.getEventType().name());
        dto.setOldValue(event.getOldValue());
        dto.setNewValue(event.getNewValue());
        dto.setDetail(event.getDetail());
        dto.setCreatedAt(event.getCreatedAt());
        return dto;
    }

    public static EscalationResultDTO toEscalationResultDTO(EscalationOutcome outcome) {
        EscalationResultDTO dto = new EscalationResultDTO();
        dto.setOutcome(outcome.status().name());
        dto.setEscalated(outcome.escalated());
        dto.setTicketCreated(outcome.ticketCreated());
        dto.setReason(outcome.reason());
        dto.setErrorMessage(outcome.errorMessage());
        TicketEntity ticket = outcome.ticket();
        if (ticket != null) {
            dto.setTicketId(ticket.getId());
            dto.setPriority(ticket.getPriority() == null ? null : ticket.getPriority().getCode());
            dto.setRoutingMethod(ticket.getRoutingMethod() == null ? null : ticket.getRoutingMethod().name());
            dto.setDepartmentId(ticket.getDepartmentId());
            dto.setAssignedAgentId(ticket.getAssignedAgentId());
        } else if (outcome.priority() != null) {
            dto.setPriority(outcome.priority().getCode());
        }
        return dto;
    }
}
