package com.supportdesk.domain.routing.service;

import com.supportdesk.domain.routing.model.entity.DepartmentEntity;
import com.supportdesk.domain.routing.model.entity.RoutingRuleEntity;
import com.supportdesk.domain.routing.model.valobj.DepartmentPrediction;
import com.supportdesk.domain.routing.model.valobj.RoutingDecision;
import com.supportdesk.types.enums.RoutingMethodEnum;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * 部门路由领域服务：AI 结果采纳判断 + 关键词兜底。
 */
@Service
public class DepartmentRoutingDomainService {

    public RoutingDecision decide(DepartmentPrediction prediction,
                                  String messageText,
                                  List<DepartmentEntity> departments,
                                  List<RoutingRuleEntity> orderedRules,
                                  double confidenceThreshold) {
        Double aiConfidence = prediction == null ? null : prediction.confidence();
        String aiDepartment = prediction == null ? null : prediction.departmentName();

        DepartmentEntity predicted = acceptPrediction(prediction, departments, confidenceThreshold);
        if (predicted != null) {
            return new RoutingDecision(predicted.getId(), RoutingMethodEnum.AI, null, aiConfidence, aiDepartment);
        }

        RoutingRuleEntity rule = matchRule(messageText, orderedRules);
        if (rule != null) {
            return new RoutingDecision(rule.getDepartmentId(), RoutingMethodEnum.FALLBACK, rule.getId(),
                    aiConfidence, aiDepartment);
        }
        return new RoutingDecision(null, null, null, aiConfidence, aiDepartment);
    }

    /**
     * 置信度达到阈值且预测名称能对应到已知部门时采纳。
     */
    public DepartmentEntity acceptPrediction(DepartmentPrediction prediction,
                                             List<DepartmentEntity> departments,
                                             double confidenceThreshold) {
        if (prediction == null || !prediction.available() || prediction.confidence() == null) {
            return null;
        }
        if (prediction.confidence() < confidenceThreshold || departments == null) {
            return null;
        }
        for (DepartmentEntity department : departments) {
            if (department != null && department.nameMatches(prediction.departmentName())) {
                return department;
            }
        }
        return null;
    }

    public RoutingRuleEntity matchRule(String messageText, List<RoutingRuleEntity> orderedRules) {
        if (messageText == null || messageText.isBlank() || orderedRules == null) {
            return null;
        }
        String normalized = messageText.toLowerCase(Locale.ROOT);
        for (RoutingRuleEntity rule : orderedRules) {
            if (rule != null && rule.getDepartmentId() != null && rule.matches(normalized)) {
                return rule;
            }
        }
        return null;
    }
}
