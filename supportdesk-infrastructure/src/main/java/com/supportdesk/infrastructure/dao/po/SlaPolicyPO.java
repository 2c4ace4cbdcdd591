package com.supportdesk.infrastructure.dao.po;

import com.supportdesk.types.enums.TicketPriorityEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SLA 策略 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaPolicyPO {

    private Long id;

    private Long departmentId;

    private TicketPriorityEnum priority;

    private Integer firstResponseMinutes;

    private Integer resolutionMinutes;

    private Integer escalationMinutes;
}
