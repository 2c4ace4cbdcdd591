package com.supportdesk.types.enums;

/**
 * 工单部门路由方式。未路由时字段为 null。
 */
public enum RoutingMethodEnum {

    /** 分类器高置信度命中 */
    AI,

    /** 关键词规则命中 */
    FALLBACK
}
