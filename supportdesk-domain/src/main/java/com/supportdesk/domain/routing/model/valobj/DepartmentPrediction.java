package com.supportdesk.domain.routing.model.valobj;

/**
 * 分类器输出
 *
 * @param departmentName 预测部门名称
 * @param confidence     置信度 [0, 1]
 * @param available      分类器是否给出了可用结果（超时/失败时为 false）
 * @param failureReason  不可用原因
 */
public record DepartmentPrediction(String departmentName,
                                   Double confidence,
                                   boolean available,
                                   String failureReason) {

    public static DepartmentPrediction of(String departmentName, Double confidence) {
        return new DepartmentPrediction(departmentName, confidence, true, null);
    }

    public static DepartmentPrediction unavailable(String failureReason) {
        return new DepartmentPrediction(null, null, false, failureReason);
    }
}
