package com.supportdesk.domain.access.service;

import com.supportdesk.domain.access.model.valobj.FilterCondition;
import com.supportdesk.domain.access.model.valobj.RetrievalFilter;
import com.supportdesk.domain.access.model.valobj.UserContext;
import com.supportdesk.types.enums.VisibilityEnum;
import com.supportdesk.types.exception.PermissionDeniedException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 检索访问控制领域服务（纯计算，不做 I/O）。
 */
@Service
public class AccessControlDomainService {

    private static final Set<String> ADMIN_ROLES = Set.of("ADMIN", "SUPERADMIN");
    private static final String HR_ROLE_PREFIX = "HR";

    public RetrievalFilter build(UserContext context) {
        return build(context, null);
    }

    /**
     * @param documentId 可选的目标文档 ID，管理员谓词仅包含该条件
     * @throws PermissionDeniedException 上下文缺失或未验证
     */
    public RetrievalFilter build(UserContext context, String documentId) {
        if (context == null || !context.verified()) {
            throw new PermissionDeniedException("Unverified user context");
        }
        Set<String> roles = normalizeRoles(context.roles());
        String department = StringUtils.isBlank(context.department())
                ? null
                : context.department().trim().toUpperCase(Locale.ROOT);
        Set<VisibilityEnum> visibility = allowedVisibility(roles);

        List<FilterCondition> must = new ArrayList<>();
        if (isAdmin(roles)) {
            if (StringUtils.isNotBlank(documentId)) {
                must.add(FilterCondition.matchValue(RetrievalFilter.FIELD_DOCUMENT_ID, documentId.trim()));
            }
            return new RetrievalFilter(true, visibility, must, null);
        }

        must.add(FilterCondition.matchAny(RetrievalFilter.FIELD_ALLOWED_ROLES, roles));
        must.add(FilterCondition.matchAny(RetrievalFilter.FIELD_VISIBILITY,
                visibility.stream().map(Enum::name).toList()));
        if (department != null) {
            must.add(FilterCondition.matchValue(RetrievalFilter.FIELD_DEPARTMENT, department));
        }
        if (StringUtils.isNotBlank(documentId)) {
            must.add(FilterCondition.matchValue(RetrievalFilter.FIELD_DOCUMENT_ID, documentId.trim()));
        }
        return new RetrievalFilter(false, visibility, must, null);
    }

    public Set<VisibilityEnum> allowedVisibility(Set<String> normalizedRoles) {
        if (isAdmin(normalizedRoles)) {
            return EnumSet.allOf(VisibilityEnum.class);
        }
        for (String role : normalizedRoles) {
            if (role.startsWith(HR_ROLE_PREFIX)) {
                return EnumSet.of(VisibilityEnum.PUBLIC, VisibilityEnum.INTERNAL);
            }
        }
        return EnumSet.of(VisibilityEnum.PUBLIC);
    }

    public boolean isAdmin(Set<String> normalizedRoles) {
        for (String role : normalizedRoles) {
            if (ADMIN_ROLES.contains(role)) {
                return true;
            }
        }
        return false;
    }

    private Set<String> normalizeRoles(List<String> roles) {
        Set<String> normalized = new LinkedHashSet<>();
        if (roles == null) {
            return normalized;
        }
        for (String role : roles) {
            if (StringUtils.isNotBlank(role)) {
                normalized.add(role.trim().toUpperCase(Locale.ROOT));
            }
        }
        return normalized;
    }
}
