package com.supportdesk.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 部门 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentPO {

    private Long id;

    private String name;

    private Long managerId;
}
