package com.supportdesk.trigger.http;

import com.supportdesk.api.response.Response;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.exception.AppException;
import com.supportdesk.types.exception.ConsistencyConflictException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理。HTTP 状态恒为 200，错误语义只体现在 {@code Response.code}。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        ResponseCode responseCode = resolveResponseCode(ex.getCode());
        String code = StringUtils.defaultIfBlank(ex.getCode(), responseCode.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), responseCode.getInfo());
        String detail = ex instanceof ConsistencyConflictException conflict
                ? "conversationId=" + conflict.getConversationId() + ", retryable=" + conflict.isRetryable()
                : "-";
        logWarn(request, ex, code, info, detail);
        return failure(code, info);
    }

    /**
     * 服务层未包装、直接逃逸出来的 Spring 数据访问异常。锁冲突可重试，其余瞬时故障按依赖不可用处理。
     */
    @ExceptionHandler(TransientDataAccessException.class)
    public Response<Object> handleTransientDataAccess(TransientDataAccessException ex, HttpServletRequest request) {
        ResponseCode responseCode = ex instanceof ConcurrencyFailureException
                ? ResponseCode.CONSISTENCY_CONFLICT
                : ResponseCode.DEPENDENCY_UNAVAILABLE;
        logWarn(request, ex, responseCode.getCode(), truncate(ex.getMessage()), "-");
        return failure(responseCode.getCode(), responseCode.getInfo());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        logWarn(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info, "-");
        return failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                path(request), method(request), mdc("traceId"), mdc("requestId"),
                ex.getClass().getSimpleName(), ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage()), ex);
        return failure(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private void logWarn(HttpServletRequest request, Exception ex, String code, String info, String detail) {
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}, detail={}",
                path(request), method(request), mdc("traceId"), mdc("requestId"),
                ex.getClass().getSimpleName(), code, info, detail);
    }

    private Response<Object> failure(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private ResponseCode resolveResponseCode(String code) {
        if (StringUtils.isNotBlank(code)) {
            for (ResponseCode candidate : ResponseCode.values()) {
                if (candidate.getCode().equals(code)) {
                    return candidate;
                }
            }
        }
        return ResponseCode.UN_ERROR;
    }

    private String path(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String method(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String mdc(String key) {
        return StringUtils.defaultIfBlank(MDC.get(key), "-");
    }

    private String truncate(String text) {
        return StringUtils.truncate(text, MAX_INFO_LENGTH);
    }
}
