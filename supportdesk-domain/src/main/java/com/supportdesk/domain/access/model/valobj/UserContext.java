package com.supportdesk.domain.access.model.valobj;

import java.util.List;
import java.util.Objects;

/**
 * 已由认证层校验过的用户上下文
 *
 * @param userId     用户 ID
 * @param roles      角色（任意大小写，空元素被丢弃）
 * @param department 部门，可空
 * @param verified   是否已验证
 */
public record UserContext(String userId, List<String> roles, String department, boolean verified) {

    public UserContext {
        roles = roles == null ? List.of() : roles.stream().filter(Objects::nonNull).toList();
    }
}
