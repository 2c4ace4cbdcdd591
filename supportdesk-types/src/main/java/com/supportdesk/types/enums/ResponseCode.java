package com.supportdesk.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息，同时作为 {@link com.supportdesk.types.exception.AppException} 的错误码来源。
 * </p>
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 无权限（未验证或越权的访问上下文） */
    PERMISSION_DENIED("0003", "无访问权限"),

    /** 引用的会话/消息/工单不存在 */
    NOT_FOUND("0004", "资源不存在"),

    /** 外部依赖暂不可用（分类器超时等） */
    DEPENDENCY_UNAVAILABLE("0005", "外部依赖不可用"),

    /** 并发写冲突，可重试 */
    CONSISTENCY_CONFLICT("0006", "并发冲突，请重试"),

    /** 状态机不允许的流转 */
    ILLEGAL_STATE("0007", "当前状态不允许该操作");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
