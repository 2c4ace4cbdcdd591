package com.supportdesk.domain.conversation.model.entity;

import com.supportdesk.types.enums.ConversationStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话领域实体
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Data
public class ConversationEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 部门提示（可空）
     */
    private Long departmentId;

    /**
     * 状态
     */
    private ConversationStatusEnum status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 标记为已升级，已升级或已关闭时返回 false。
     */
    public boolean markEscalated(LocalDateTime now) {
        if (status == ConversationStatusEnum.ESCALATED || status == ConversationStatusEnum.CLOSED) {
            return false;
        }
        this.status = ConversationStatusEnum.ESCALATED;
        this.updatedAt = now;
        return true;
    }
}
