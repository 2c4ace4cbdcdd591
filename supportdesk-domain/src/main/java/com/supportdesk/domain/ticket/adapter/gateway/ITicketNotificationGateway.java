package com.supportdesk.domain.ticket.adapter.gateway;

import com.supportdesk.domain.ticket.model.entity.TicketEntity;
import com.supportdesk.domain.ticket.model.valobj.NotifyResult;

/**
 * 工单通知网关。实现不得抛出异常，失败通过 {@link NotifyResult} 返回。
 */
public interface ITicketNotificationGateway {

    /**
     * SLA 违约通知（工单已升级后调用）
     */
    NotifyResult notifySlaBreach(TicketEntity ticket);
}
