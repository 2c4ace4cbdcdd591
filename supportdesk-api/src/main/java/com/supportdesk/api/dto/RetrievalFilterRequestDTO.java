package com.supportdesk.api.dto;

import lombok.Data;

/**
 * 检索过滤条件构建请求。用户身份不在请求体中传递，由上游鉴权层以请求属性注入。
 */
@Data
public class RetrievalFilterRequestDTO {

    /** 仅管理员场景使用：限定单个文档 */
    private String documentId;
}
