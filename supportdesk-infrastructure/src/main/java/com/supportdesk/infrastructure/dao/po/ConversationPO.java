package com.supportdesk.infrastructure.dao.po;

import com.supportdesk.types.enums.ConversationStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 部门提示 (关联 departments.id，可空)
     */
    private Long departmentId;

    /**
     * 状态 OPEN / CLOSED / ESCALATED
     */
    private ConversationStatusEnum status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
