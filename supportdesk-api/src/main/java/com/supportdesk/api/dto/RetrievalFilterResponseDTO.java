package com.supportdesk.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 检索过滤条件。payload 为向量检索端可直接消费的 must 结构。
 */
@Data
public class RetrievalFilterResponseDTO {

    private boolean adminBypass;
    private List<String> allowedVisibility;
    private Map<String, Object> payload;
}
