package com.supportdesk.test;

import com.supportdesk.api.dto.TicketDTO;
import com.supportdesk.api.dto.TicketEventDTO;
import com.supportdesk.trigger.application.query.TicketQueryService;
import com.supportdesk.trigger.http.GlobalApiExceptionHandler;
import com.supportdesk.trigger.http.TicketController;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class TicketControllerTest {

    private MockMvc mockMvc;
    private TicketQueryService ticketQueryService;

    @BeforeEach
    public void setUp() {
        this.ticketQueryService = mock(TicketQueryService.class);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TicketController(ticketQueryService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldReturnTicket() throws Exception {
        TicketDTO ticket = new TicketDTO();
        ticket.setId(5L);
        ticket.setStatus("OPEN");
        ticket.setPriority("HIGH");
        ticket.setRoutingMethod("AI");
        when(ticketQueryService.getTicket(5L)).thenReturn(ticket);

        mockMvc.perform(get("/api/tickets/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.id").value(5))
                .andExpect(jsonPath("$.data.priority").value("HIGH"))
                .andExpect(jsonPath("$.data.routingMethod").value("AI"));
    }

    @Test
    public void shouldReturnNotFoundCode() throws Exception {
        when(ticketQueryService.getTicket(9L)).thenThrow(new AppException(ResponseCode.NOT_FOUND, "Ticket not found: 9"));

        mockMvc.perform(get("/api/tickets/9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()));
    }

    @Test
    public void shouldListWithFiltersAndDefaultPaging() throws Exception {
        TicketDTO ticket = new TicketDTO();
        ticket.setId(1L);
        when(ticketQueryService.listTickets("OPEN", null, 1, 20)).thenReturn(List.of(ticket));

        mockMvc.perform(get("/api/tickets").param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].id").value(1));
        verify(ticketQueryService).listTickets("OPEN", null, 1, 20);
    }

    @Test
    public void shouldRejectUnknownPriorityFilter() throws Exception {
        when(ticketQueryService.listTickets(null, "URGENT", 1, 20))
                .thenThrow(new IllegalArgumentException("Unknown ticket priority code: URGENT"));

        mockMvc.perform(get("/api/tickets").param("priority", "URGENT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldListEventsWithDetail() throws Exception {
        TicketEventDTO event = new TicketEventDTO();
        event.setEventType("ROUTED");
        event.setNewValue("1");
        event.setDetail(Map.of("routingMethod", "FALLBACK"));
        when(ticketQueryService.listEvents(5L)).thenReturn(List.of(event));

        mockMvc.perform(get("/api/tickets/5/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].eventType").value("ROUTED"))
                .andExpect(jsonPath("$.data[0].detail.routingMethod").value("FALLBACK"));
    }
}
