package com.supportdesk.domain.assignment.model.entity;

import com.supportdesk.types.common.Constants;
import lombok.Data;

import java.util.Objects;

/**
 * 坐席实体
 */
@Data
public class SupportAgentEntity {

    private Long id;

    private String name;

    private String role;

    private Long departmentId;

    private Boolean active;

    public boolean isAssignableTo(Long targetDepartmentId) {
        return Boolean.TRUE.equals(active)
                && Constants.AGENT_ROLE.equalsIgnoreCase(role == null ? "" : role.trim())
                && (targetDepartmentId == null || Objects.equals(departmentId, targetDepartmentId));
    }
}
