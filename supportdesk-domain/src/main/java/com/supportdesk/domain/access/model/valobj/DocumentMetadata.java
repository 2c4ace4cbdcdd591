package com.supportdesk.domain.access.model.valobj;

import java.util.Set;

/**
 * 文档访问元数据（与向量库 payload 字段一致）
 */
public record DocumentMetadata(String documentId,
                               Set<String> allowedRoles,
                               Set<String> visibility,
                               String department) {

    public DocumentMetadata {
        allowedRoles = allowedRoles == null ? Set.of() : Set.copyOf(allowedRoles);
        visibility = visibility == null ? Set.of() : Set.copyOf(visibility);
    }

    /**
     * 按 payload 字段名取值，单值字段包装为单元素集合。
     */
    public Set<String> field(String key) {
        switch (key) {
            case RetrievalFilter.FIELD_ALLOWED_ROLES:
                return allowedRoles;
            case RetrievalFilter.FIELD_VISIBILITY:
                return visibility;
            case RetrievalFilter.FIELD_DEPARTMENT:
                return department == null ? Set.of() : Set.of(department);
            case RetrievalFilter.FIELD_DOCUMENT_ID:
                return documentId == null ? Set.of() : Set.of(documentId);
            default:
                return Set.of();
        }
    }
}
