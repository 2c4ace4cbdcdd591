package com.supportdesk.types.exception;

import com.supportdesk.types.enums.ResponseCode;

/**
 * 同一会话并发建单冲突，重试后仍冲突时抛出；调用方可整体重试。
 */
public class ConsistencyConflictException extends AppException {

    private static final long serialVersionUID = -5830417722219460693L;

    private final Long conversationId;

    public ConsistencyConflictException(Long conversationId, String message, Throwable cause) {
        super(ResponseCode.CONSISTENCY_CONFLICT.getCode(), message, cause);
        this.conversationId = conversationId;
    }

    public Long getConversationId() {
        return conversationId;
    }

    public boolean isRetryable() {
        return true;
    }
}
