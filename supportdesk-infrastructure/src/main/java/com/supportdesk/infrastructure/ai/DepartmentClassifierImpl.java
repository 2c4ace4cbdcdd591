package com.supportdesk.infrastructure.ai;

import com.supportdesk.domain.routing.adapter.gateway.IDepartmentClassifier;
import com.supportdesk.domain.routing.model.valobj.DepartmentPrediction;
import com.supportdesk.infrastructure.util.JsonCodec;
import com.supportdesk.types.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 基于 Spring AI ChatClient 的部门分类实现。
 * <p>
 * 要求模型只返回 {"department": "...", "confidence": 0.0~1.0}，解析失败或调用异常统一转换为
 * {@link TransientDependencyException}，由路由流程降级处理。超时由调用方控制。
 * </p>
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@Slf4j
@Component
public class DepartmentClassifierImpl implements IDepartmentClassifier {

    private static final String SYSTEM_PROMPT = "你是客服工单分诊助手，负责把用户消息归类到一个部门。只返回 JSON，不要输出任何解释。";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final JsonCodec jsonCodec;
    private final double temperature;
    private volatile ChatClient chatClient;

    @Autowired
    public DepartmentClassifierImpl(ObjectProvider<ChatModel> chatModelProvider,
                                    JsonCodec jsonCodec,
                                    @Value("${routing.ai.temperature:0.0}") double temperature) {
        this.chatModelProvider = chatModelProvider;
        this.jsonCodec = jsonCodec;
        this.temperature = temperature;
    }

    public DepartmentClassifierImpl(ChatClient chatClient, JsonCodec jsonCodec) {
        this.chatModelProvider = null;
        this.jsonCodec = jsonCodec;
        this.temperature = 0.0D;
        this.chatClient = chatClient;
    }

    @Override
    public DepartmentPrediction classify(String messageText, List<String> departmentNames) {
        if (StringUtils.isBlank(messageText)) {
            throw new TransientDependencyException("Classifier input is empty");
        }
        String content;
        try {
            ChatClient.CallResponseSpec response = resolveClient().prompt(buildPrompt(messageText, departmentNames)).call();
            content = response == null ? null : response.content();
        } catch (TransientDependencyException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TransientDependencyException("Department classifier call failed: " + ex.getMessage(), ex);
        }
        return toPrediction(jsonCodec.readEmbeddedMap(content), content);
    }

    private ChatClient resolveClient() {
        ChatClient client = chatClient;
        if (client != null) {
            return client;
        }
        synchronized (this) {
            if (chatClient == null) {
                ChatModel chatModel = chatModelProvider == null ? null : chatModelProvider.getIfAvailable();
                if (chatModel == null) {
                    throw new TransientDependencyException("No ChatModel available for department classifier");
                }
                chatClient = ChatClient.builder(chatModel)
                        .defaultSystem(SYSTEM_PROMPT)
                        .defaultOptions(ChatOptions.builder().temperature(temperature).build())
                        .build();
            }
            return chatClient;
        }
    }

    private String buildPrompt(String messageText, List<String> departmentNames) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("请判断下面这条客服消息应由哪个部门处理。");
        prompt.append("返回 JSON，字段：department（部门名称，必须取自候选列表，无法判断时为 null），");
        prompt.append("confidence（0 到 1 之间的小数）。");
        if (departmentNames != null && !departmentNames.isEmpty()) {
            prompt.append("\n候选部门：").append(String.join(", ", departmentNames));
        }
        prompt.append("\n用户消息：").append(messageText.trim());
        return prompt.toString();
    }

    private DepartmentPrediction toPrediction(Map<String, Object> payload, String rawContent) {
        if (payload == null) {
            log.debug("Department classifier returned non-json content: {}", StringUtils.abbreviate(rawContent, 200));
            throw new TransientDependencyException("Department classifier returned invalid json");
        }
        String department = readString(payload, "department", "department_name", "departmentName");
        Double confidence = readConfidence(payload.get("confidence"));
        if (confidence == null) {
            throw new TransientDependencyException("Department classifier returned no confidence");
        }
        return DepartmentPrediction.of(department, confidence);
    }

    private String readString(Map<String, Object> payload, String... keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value != null && StringUtils.isNotBlank(String.valueOf(value))) {
                return String.valueOf(value).trim();
            }
        }
        return null;
    }

    private Double readConfidence(Object value) {
        if (value == null) {
            return null;
        }
        double confidence;
        if (value instanceof Number) {
            confidence = ((Number) value).doubleValue();
        } else {
            try {
                confidence = Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        if (Double.isNaN(confidence)) {
            return null;
        }
        return Math.max(0D, Math.min(1D, confidence));
    }
}
