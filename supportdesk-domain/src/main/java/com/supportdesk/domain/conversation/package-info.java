/**
 * Conversation 领域 - 会话与消息
 *
 * <p>职责：提供升级判定所需的消息窗口，并在首次升级时标记会话。</p>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>Conversation - 会话（可携带部门提示）</li>
 *   <li>Message - 用户消息（创建后不可变，情感分由上游给出）</li>
 * </ul>
 *
 * @author supportdesk
 * @since 2025-03-02
 */
package com.supportdesk.domain.conversation;
