/**
 * Ticket 领域 - 工单生命周期
 *
 * <p>职责：工单的创建、复用、路由结果落地、分配、SLA 违约升级与人工状态流转。</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.supportdesk.domain.ticket.model.entity.TicketEntity}</li>
 * </ul>
 *
 * <h3>状态机</h3>
 * <ul>
 *   <li>OPEN -> IN_PROGRESS -> RESOLVED -> CLOSED</li>
 *   <li>OPEN / IN_PROGRESS -> CLOSED（直接关闭）</li>
 *   <li>RESOLVED -> OPEN（重新打开）</li>
 * </ul>
 *
 * <p>每次变更都伴随一条 {@link com.supportdesk.domain.ticket.model.entity.TicketEventEntity}，
 * 二者在同一事务内提交。</p>
 *
 * @author supportdesk
 * @since 2025-03-02
 */
package com.supportdesk.domain.ticket;
