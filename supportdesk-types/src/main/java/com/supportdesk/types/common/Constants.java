package com.supportdesk.types.common;

/**
 * 全局常量定义类。
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public class Constants {

    /** 逗号分隔符，用于配置项列表拆分 */
    public final static String SPLIT = ",";

    /** 升级原因拼接分隔符 */
    public final static String REASON_SEPARATOR = "; ";

    /** 审计日志 logger 名称 */
    public final static String AUDIT_LOGGER = "AUDIT";

    /** 上游鉴权层写入的请求属性：已验证的用户 ID，存在即表示上下文已验证 */
    public final static String AUTH_ATTR_USER_ID = "auth.userId";

    /** 上游鉴权层写入的请求属性：角色列表（集合或逗号分隔字符串） */
    public final static String AUTH_ATTR_ROLES = "auth.roles";

    /** 上游鉴权层写入的请求属性：所属部门 */
    public final static String AUTH_ATTR_DEPARTMENT = "auth.department";

    /** 坐席角色名 */
    public final static String AGENT_ROLE = "AGENT";

}
