/**
 * Routing 领域 - 部门路由
 *
 * <p>职责：AI 分类优先，置信度不足或不可用时退回到有序关键词规则；都未命中则不路由。</p>
 */
package com.supportdesk.domain.routing;
