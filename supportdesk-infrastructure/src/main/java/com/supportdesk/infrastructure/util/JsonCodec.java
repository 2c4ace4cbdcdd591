package com.supportdesk.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON 编解码工具（事件附加信息、分类器输出）。
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取 JSON 对象，空串返回 null，非法 JSON 抛出 AppException。
     */
    public Map<String, Object> readMap(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 宽松读取：先整体解析，失败时截取首个 '{' 到最后一个 '}' 之间的内容再试一次。
     * 两次都失败返回 null。
     */
    public Map<String, Object> readEmbeddedMap(String content) {
        if (StringUtils.isBlank(content)) {
            return null;
        }
        Map<String, Object> payload = tryReadMap(content.trim());
        if (payload != null) {
            return payload;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return tryReadMap(content.substring(start, end + 1));
        }
        return null;
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }

    private Map<String, Object> tryReadMap(String text) {
        try {
            return readMap(text);
        } catch (AppException ex) {
            return null;
        }
    }
}
