package com.supportdesk.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 路由规则 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingRulePO {

    private Long id;

    private String keyword;

    private Long departmentId;

    /**
     * 匹配顺序 (升序)
     */
    private Integer sortOrder;
}
