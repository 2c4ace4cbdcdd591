package com.supportdesk.domain.routing.model.entity;

import lombok.Data;

import java.util.Locale;

/**
 * 关键词路由规则，按 sortOrder 升序匹配，先命中者胜出。
 */
@Data
public class RoutingRuleEntity {

    private Long id;

    private String keyword;

    private Long departmentId;

    private Integer sortOrder;

    public boolean matches(String normalizedText) {
        if (keyword == null || keyword.isBlank() || normalizedText == null) {
            return false;
        }
        return normalizedText.contains(keyword.trim().toLowerCase(Locale.ROOT));
    }
}
