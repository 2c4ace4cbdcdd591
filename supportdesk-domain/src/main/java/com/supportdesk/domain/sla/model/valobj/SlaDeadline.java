package com.supportdesk.domain.sla.model.valobj;

import java.time.LocalDateTime;

/**
 * SLA 截止时间
 *
 * @param firstResponseDueAt 首次响应截止，写入 tickets.sla_due_at
 * @param resolutionDueAt    解决截止
 * @param escalationDueAt    升级截止，未配置时为 null
 */
public record SlaDeadline(LocalDateTime firstResponseDueAt,
                          LocalDateTime resolutionDueAt,
                          LocalDateTime escalationDueAt) {
}
