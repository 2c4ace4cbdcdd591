package com.supportdesk.types.exception;

import com.supportdesk.types.enums.ResponseCode;

/**
 * 访问上下文缺失、未验证或越权。始终向调用方抛出，不做降级。
 */
public class PermissionDeniedException extends AppException {

    private static final long serialVersionUID = -2071559313460978516L;

    public PermissionDeniedException(String message) {
        super(ResponseCode.PERMISSION_DENIED.getCode(), message);
    }
}
