package com.supportdesk.test;

import com.supportdesk.api.response.Response;
import com.supportdesk.trigger.http.GlobalApiExceptionHandler;
import com.supportdesk.types.enums.ResponseCode;
import com.supportdesk.types.exception.AppException;
import com.supportdesk.types.exception.ConsistencyConflictException;
import com.supportdesk.types.exception.PermissionDeniedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldHandleAppException() throws Exception {
        mockMvc.perform(get("/api/test/app-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("Ticket not found: 9"));
    }

    @Test
    public void shouldHandleConsistencyConflict() throws Exception {
        mockMvc.perform(get("/api/test/conflict"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.CONSISTENCY_CONFLICT.getCode()));
    }

    @Test
    public void shouldMapEscapedLockFailureToConsistencyConflict() throws Exception {
        mockMvc.perform(get("/api/test/lock-failure"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.CONSISTENCY_CONFLICT.getCode()));
    }

    @Test
    public void shouldMapQueryTimeoutToDependencyUnavailable() throws Exception {
        mockMvc.perform(get("/api/test/query-timeout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.DEPENDENCY_UNAVAILABLE.getCode()));
    }

    @Test
    public void shouldHandlePermissionDenied() throws Exception {
        mockMvc.perform(get("/api/test/denied"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.PERMISSION_DENIED.getCode()));
    }

    @Test
    public void shouldHandleIllegalArgumentAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/bad-enum"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("Unknown ticket priority code: URGENT"));
    }

    @Test
    public void shouldHandleUnknownException() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchExceptionAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/app-error")
        public Response<Void> appError() {
            throw new AppException(ResponseCode.NOT_FOUND, "Ticket not found: 9");
        }

        @GetMapping("/api/test/conflict")
        public Response<Void> conflict() {
            throw new ConsistencyConflictException(3L, "Concurrent ticket write for conversation 3, retry later", null);
        }

        @GetMapping("/api/test/lock-failure")
        public Response<Void> lockFailure() {
            throw new CannotAcquireLockException("could not obtain lock on row in relation \"tickets\"");
        }

        @GetMapping("/api/test/query-timeout")
        public Response<Void> queryTimeout() {
            throw new QueryTimeoutException("canceling statement due to statement timeout");
        }

        @GetMapping("/api/test/denied")
        public Response<Void> denied() {
            throw new PermissionDeniedException("Unverified user context");
        }

        @GetMapping("/api/test/bad-enum")
        public Response<Void> badEnum() {
            throw new IllegalArgumentException("Unknown ticket priority code: URGENT");
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(String.valueOf(id))
                    .build();
        }
    }
}
