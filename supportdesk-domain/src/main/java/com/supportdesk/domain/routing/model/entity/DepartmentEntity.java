package com.supportdesk.domain.routing.model.entity;

import lombok.Data;

/**
 * 部门实体
 */
@Data
public class DepartmentEntity {

    private Long id;

    /**
     * 部门名称（唯一，AI 按名称预测）
     */
    private String name;

    private Long managerId;

    public boolean nameMatches(String candidate) {
        return name != null && candidate != null && name.trim().equalsIgnoreCase(candidate.trim());
    }
}
