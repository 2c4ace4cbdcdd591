/**
 * SLA 领域 - 服务等级策略
 *
 * <p>职责：按（部门, 优先级）解析 SLA 策略并计算截止时间。以工单创建时间为基准，
 * 相同输入始终得到相同截止时间。</p>
 */
package com.supportdesk.domain.sla;
