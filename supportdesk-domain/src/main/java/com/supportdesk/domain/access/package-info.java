/**
 * Access 领域 - 知识检索访问控制
 *
 * <p>职责：把已验证的用户上下文（角色、部门）转换为检索谓词，交给外部向量检索使用。
 * 失败即拒绝：上下文缺失或未验证时直接抛出 PermissionDeniedException，不构造任何谓词。</p>
 *
 * <h3>字段约定</h3>
 * <ul>
 *   <li>allowed_roles - 文档允许的角色集合</li>
 *   <li>visibility - PUBLIC / INTERNAL / CONFIDENTIAL</li>
 *   <li>department - 文档所属部门（大写）</li>
 *   <li>document_id - 文档 ID（管理员仅按此过滤）</li>
 * </ul>
 */
package com.supportdesk.domain.access;
