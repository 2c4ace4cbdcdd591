/**
 * Escalation 领域 - 升级判定
 *
 * <p>职责：基于最新消息与最近消息窗口判定是否需要升级为工单，以及工单优先级。</p>
 *
 * <h3>规则</h3>
 * <ul>
 *   <li>强负面：最新消息情感分低于强负面阈值，优先级 HIGH</li>
 *   <li>持续负面：最近 N 条消息情感分均值低于中度阈值，优先级 MEDIUM</li>
 *   <li>关键词：最新消息包含升级关键词，优先级 CRITICAL</li>
 * </ul>
 *
 * <p>所有规则都会被评估，取最高优先级，原因按规则顺序拼接。</p>
 */
package com.supportdesk.domain.escalation;
