package com.supportdesk.domain.ticket.model.valobj;

/**
 * 通知发送结果
 */
public record NotifyResult(boolean delivered, String channel, String errorMessage) {

    public static NotifyResult delivered(String channel) {
        return new NotifyResult(true, channel, null);
    }

    public static NotifyResult failed(String channel, String errorMessage) {
        return new NotifyResult(false, channel, errorMessage);
    }
}
