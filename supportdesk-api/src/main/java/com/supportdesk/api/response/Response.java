package com.supportdesk.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 封装所有API接口的响应结果，包含响应码、响应描述和响应数据。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author supportdesk
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = -1843752196608914123L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 响应数据 */
    private T data;

}
