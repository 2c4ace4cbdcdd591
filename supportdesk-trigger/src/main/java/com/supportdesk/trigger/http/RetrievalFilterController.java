package com.supportdesk.trigger.http;

import com.supportdesk.api.dto.RetrievalFilterRequestDTO;
import com.supportdesk.api.dto.RetrievalFilterResponseDTO;
import com.supportdesk.api.response.Response;
import com.supportdesk.domain.access.model.valobj.RetrievalFilter;
import com.supportdesk.domain.access.model.valobj.UserContext;
import com.supportdesk.domain.access.service.AccessControlDomainService;
import com.supportdesk.types.common.Constants;
import com.supportdesk.types.enums.ResponseCode;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * 知识检索权限谓词 API。
 * <p>
 * 用户上下文只取自上游鉴权层写入的请求属性（{@code auth.*}），请求体里的身份字段一律忽略；
 * 没有 {@code auth.userId} 即视为未验证，按无权限失败关闭。
 * </p>
 */
@RestController
@RequestMapping("/api/retrieval")
public class RetrievalFilterController {

    private static final Logger AUDIT = LoggerFactory.getLogger(Constants.AUDIT_LOGGER);

    private final AccessControlDomainService accessControlDomainService;

    public RetrievalFilterController(AccessControlDomainService accessControlDomainService) {
        this.accessControlDomainService = accessControlDomainService;
    }

    @PostMapping("/filter")
    public Response<RetrievalFilterResponseDTO> buildFilter(@RequestBody(required = false) RetrievalFilterRequestDTO request,
                                                            HttpServletRequest httpRequest) {
        UserContext context = resolveUserContext(httpRequest);
        RetrievalFilter filter = accessControlDomainService.build(context, request == null ? null : request.getDocumentId());
        AUDIT.info("RBAC_FILTER_BUILT userId={}, roles={}, department={}, adminBypass={}, visibility={}",
                context.userId(), context.roles(), context.department(), filter.isAdminBypass(), filter.getAllowedVisibility());

        RetrievalFilterResponseDTO dto = new RetrievalFilterResponseDTO();
        dto.setAdminBypass(filter.isAdminBypass());
        dto.setAllowedVisibility(filter.getAllowedVisibility().stream().map(Enum::name).sorted().toList());
        dto.setPayload(filter.toPayload());
        return Response.<RetrievalFilterResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(dto)
                .build();
    }

    private UserContext resolveUserContext(HttpServletRequest httpRequest) {
        Object userId = httpRequest.getAttribute(Constants.AUTH_ATTR_USER_ID);
        Object department = httpRequest.getAttribute(Constants.AUTH_ATTR_DEPARTMENT);
        String resolvedUserId = userId == null ? null : StringUtils.trimToNull(String.valueOf(userId));
        return new UserContext(resolvedUserId,
                toRoles(httpRequest.getAttribute(Constants.AUTH_ATTR_ROLES)),
                department == null ? null : String.valueOf(department),
                resolvedUserId != null);
    }

    private List<String> toRoles(Object attribute) {
        if (attribute instanceof Collection<?> values) {
            List<String> roles = new ArrayList<>();
            for (Object value : values) {
                if (value != null) {
                    roles.add(String.valueOf(value));
                }
            }
            return roles;
        }
        if (attribute instanceof String text && StringUtils.isNotBlank(text)) {
            return Arrays.asList(StringUtils.split(text, Constants.SPLIT));
        }
        return List.of();
    }
}
