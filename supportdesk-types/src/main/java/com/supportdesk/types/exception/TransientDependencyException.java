package com.supportdesk.types.exception;

import com.supportdesk.types.enums.ResponseCode;

/**
 * 外部依赖（部门分类器等）超时或失败。由路由流程本地吸收，降级为关键词路由。
 */
public class TransientDependencyException extends AppException {

    private static final long serialVersionUID = 6613904271854870125L;

    public TransientDependencyException(String message) {
        super(ResponseCode.DEPENDENCY_UNAVAILABLE.getCode(), message);
    }

    public TransientDependencyException(String message, Throwable cause) {
        super(ResponseCode.DEPENDENCY_UNAVAILABLE.getCode(), message, cause);
    }
}
