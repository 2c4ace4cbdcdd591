package com.supportdesk.types.exception;

import com.supportdesk.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一处理应用中的业务异常，包含异常码和异常描述信息。
 * 校验失败（会话/消息引用不存在、参数非法）直接以 {@link ResponseCode#ILLEGAL_PARAMETER}
 * 或 {@link ResponseCode#NOT_FOUND} 抛出；权限、外部依赖与并发冲突各有专门子类，便于调用方按类型捕获。
 * </p>
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 3486521950735381462L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含响应码和描述信息的 AppException。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     */
    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return getClass().getName() + "{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
