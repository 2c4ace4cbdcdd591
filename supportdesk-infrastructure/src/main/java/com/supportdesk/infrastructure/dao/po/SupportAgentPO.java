package com.supportdesk.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 坐席 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportAgentPO {

    private Long id;

    private String name;

    private String role;

    private Long departmentId;

    private Boolean active;
}
