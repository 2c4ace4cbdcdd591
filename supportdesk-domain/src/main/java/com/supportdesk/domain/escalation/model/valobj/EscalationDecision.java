package com.supportdesk.domain.escalation.model.valobj;

import com.supportdesk.types.common.Constants;
import com.supportdesk.types.enums.TicketPriorityEnum;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 升级判定结果
 *
 * @param escalate   是否升级
 * @param priority   命中规则中的最高优先级，不升级时为 null
 * @param firedRules 命中的规则（按规则顺序）
 * @param reasons    与 firedRules 一一对应的原因
 */
public record EscalationDecision(boolean escalate,
                                 TicketPriorityEnum priority,
                                 List<EscalationRuleEnum> firedRules,
                                 List<String> reasons) {

    public static EscalationDecision none() {
        return new EscalationDecision(false, null, List.of(), List.of());
    }

    public static EscalationDecision of(List<EscalationRuleEnum> firedRules, List<String> reasons) {
        if (firedRules == null || firedRules.isEmpty()) {
            return none();
        }
        TicketPriorityEnum priority = null;
        for (EscalationRuleEnum rule : firedRules) {
            priority = TicketPriorityEnum.max(priority, rule.getPriority());
        }
        return new EscalationDecision(true, priority, List.copyOf(firedRules), List.copyOf(reasons));
    }

    public String reason() {
        return reasons == null ? null : reasons.stream().collect(Collectors.joining(Constants.REASON_SEPARATOR));
    }
}
