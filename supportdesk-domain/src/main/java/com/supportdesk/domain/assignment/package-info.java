/**
 * Assignment 领域 - 坐席分配
 *
 * <p>职责：在部门内选择当前 OPEN 工单最少的活跃坐席，负载相同按 ID 升序。</p>
 */
package com.supportdesk.domain.assignment;
