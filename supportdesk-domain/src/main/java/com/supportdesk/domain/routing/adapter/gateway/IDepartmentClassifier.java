package com.supportdesk.domain.routing.adapter.gateway;

import com.supportdesk.domain.routing.model.valobj.DepartmentPrediction;

import java.util.List;

/**
 * 部门分类器（外部 AI 服务）
 *
 * @author supportdesk
 * @since 2025-03-02
 */
public interface IDepartmentClassifier {

    /**
     * 对消息文本进行部门分类。
     *
     * @param messageText     消息文本
     * @param departmentNames 候选部门名称
     * @throws com.supportdesk.types.exception.TransientDependencyException 服务不可用或返回无法解析
     */
    DepartmentPrediction classify(String messageText, List<String> departmentNames);
}
