package com.supportdesk.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * HTTP 链路日志过滤器。
 * <p>
 * 为每个 /api 请求分配 traceId/requestId（优先沿用请求头），并把路径中的工单号、会话号放进 MDC，
 * 这样服务层日志不用再逐条携带这两个字段也能按工单检索。出站日志记录信封里的业务码和耗时。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";

    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_TICKET_ID = "ticketId";
    private static final String MDC_CONVERSATION_ID = "conversationId";

    private static final String TICKET_PATH = "/api/tickets/{ticketId}/**";
    private static final String CONVERSATION_PATH = "/api/conversations/{conversationId}/**";

    private final ObjectMapper objectMapper;
    private final HttpTraceLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper, HttpTraceLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        if (anyMatch(properties.getExcludePathPatterns(), path)) {
            return true;
        }
        List<String> includes = properties.getIncludePathPatterns();
        return includes != null && !includes.isEmpty() && !anyMatch(includes, path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        String traceId = headerOrNewId(request, HEADER_TRACE_ID);
        String requestId = headerOrNewId(request, HEADER_REQUEST_ID);
        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        putPathVariable(TICKET_PATH, path, MDC_TICKET_ID);
        putPathVariable(CONVERSATION_PATH, path, MDC_CONVERSATION_ID);

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        long startedAt = System.currentTimeMillis();
        log.info("HTTP_IN method={}, path={}", request.getMethod(), path);
        try {
            filterChain.doFilter(request, wrapper);
            long costMs = System.currentTimeMillis() - startedAt;
            log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}",
                    request.getMethod(), path, wrapper.getStatus(), envelopeCode(wrapper), costMs,
                    costMs >= properties.getSlowRequestThresholdMs());
            wrapper.copyBodyToResponse();
        } catch (IOException | ServletException | RuntimeException ex) {
            log.warn("HTTP_OUT method={}, path={}, outcome=error, costMs={}, errorType={}",
                    request.getMethod(), path, System.currentTimeMillis() - startedAt, ex.getClass().getSimpleName());
            throw ex;
        } finally {
            MDC.remove(MDC_CONVERSATION_ID);
            MDC.remove(MDC_TICKET_ID);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private void putPathVariable(String pattern, String path, String mdcKey) {
        if (!pathMatcher.match(pattern, path)) {
            return;
        }
        String value = pathMatcher.extractUriTemplateVariables(pattern, path).get(mdcKey);
        if (StringUtils.isNumeric(value)) {
            MDC.put(mdcKey, value);
        }
    }

    private String headerOrNewId(HttpServletRequest request, String header) {
        String value = StringUtils.trimToNull(request.getHeader(header));
        return value != null ? value : UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * 从响应信封中取 code 字段；非 JSON 或解析失败时返回 "-"。
     */
    private String envelopeCode(ContentCachingResponseWrapper wrapper) {
        byte[] body = wrapper.getContentAsByteArray();
        String contentType = wrapper.getContentType();
        if (body.length == 0 || contentType == null || !MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.parseMediaType(contentType))) {
            return "-";
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code == null ? "-" : code.asText();
        } catch (IOException ex) {
            log.debug("Response envelope not parseable. error={}", ex.getMessage());
            return "-";
        }
    }

    private boolean anyMatch(List<String> patterns, String path) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }
}
