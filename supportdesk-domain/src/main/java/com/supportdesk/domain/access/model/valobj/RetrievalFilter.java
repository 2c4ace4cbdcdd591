package com.supportdesk.domain.access.model.valobj;

import com.supportdesk.types.enums.VisibilityEnum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 检索谓词：must 中的条件全部成立，must_not 中的条件全部不成立。
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public final class RetrievalFilter {

    public static final String FIELD_ALLOWED_ROLES = "allowed_roles";
    public static final String FIELD_VISIBILITY = "visibility";
    public static final String FIELD_DEPARTMENT = "department";
    public static final String FIELD_DOCUMENT_ID = "document_id";

    private final boolean adminBypass;
    private final Set<VisibilityEnum> allowedVisibility;
    private final List<FilterCondition> must;
    private final List<FilterCondition> mustNot;

    public RetrievalFilter(boolean adminBypass,
                           Set<VisibilityEnum> allowedVisibility,
                           List<FilterCondition> must,
                           List<FilterCondition> mustNot) {
        this.adminBypass = adminBypass;
        this.allowedVisibility = allowedVisibility == null || allowedVisibility.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(allowedVisibility));
        this.must = must == null ? List.of() : List.copyOf(must);
        this.mustNot = mustNot == null ? List.of() : List.copyOf(mustNot);
    }

    public static RetrievalFilter of(List<FilterCondition> must) {
        return new RetrievalFilter(false, null, must, null);
    }

    public boolean isAdminBypass() {
        return adminBypass;
    }

    public Set<VisibilityEnum> getAllowedVisibility() {
        return allowedVisibility;
    }

    public List<FilterCondition> getMust() {
        return must;
    }

    public List<FilterCondition> getMustNot() {
        return mustNot;
    }

    public boolean hasCondition(String key) {
        return must.stream().anyMatch(condition -> condition.getKey().equals(key));
    }

    /**
     * 拼接两个谓词的 must / must_not，用于在访问控制之上叠加自定义约束。
     */
    public RetrievalFilter merge(RetrievalFilter extra) {
        if (extra == null) {
            return this;
        }
        List<FilterCondition> mergedMust = new ArrayList<>(must);
        mergedMust.addAll(extra.must);
        List<FilterCondition> mergedMustNot = new ArrayList<>(mustNot);
        mergedMustNot.addAll(extra.mustNot);
        Set<VisibilityEnum> visibility = allowedVisibility.isEmpty() ? extra.allowedVisibility : allowedVisibility;
        return new RetrievalFilter(adminBypass && extra.adminBypass, visibility, mergedMust, mergedMustNot);
    }

    /**
     * 进程内求值，供检索结果后置过滤使用。
     */
    public boolean matches(DocumentMetadata document) {
        if (document == null) {
            return false;
        }
        for (FilterCondition condition : must) {
            if (!condition.test(document.field(condition.getKey()))) {
                return false;
            }
        }
        for (FilterCondition condition : mustNot) {
            if (condition.test(document.field(condition.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 输出向量检索可直接消费的 payload，空列表不输出。
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (!must.isEmpty()) {
            payload.put("must", must.stream().map(FilterCondition::toPayload).toList());
        }
        if (!mustNot.isEmpty()) {
            payload.put("must_not", mustNot.stream().map(FilterCondition::toPayload).toList());
        }
        return payload;
    }
}
