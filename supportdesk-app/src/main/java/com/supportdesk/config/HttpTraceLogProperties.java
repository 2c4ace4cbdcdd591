package com.supportdesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * /api 请求链路日志开关与路径范围。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class HttpTraceLogProperties {

    /** 是否启用 HTTP 入口日志。 */
    private boolean enabled = true;

    /** 需要记录日志的路径模式。 */
    private List<String> includePathPatterns = Arrays.asList("/api/**");

    /** 需要排除日志的路径模式。 */
    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** 超过该耗时（毫秒）的请求在出站日志里标记 slow=true。 */
    private long slowRequestThresholdMs = 1000L;
}
