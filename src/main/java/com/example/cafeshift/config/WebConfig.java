package com.example.cafeshift.config;

import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.employee.EmployeeRole;
import com.example.cafeshift.exception.ValidationException;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;
import java.util.Locale;

/**
 * Builds the {@link RequestContext} of each API call from the caller headers set by the
 * gateway in front of this service.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_ROLE_HEADER = "X-Actor-Role";

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new RequestContextArgumentResolver());
    }

    static class RequestContextArgumentResolver implements HandlerMethodArgumentResolver {

        @Override
        public boolean supportsParameter(MethodParameter parameter) {
            return RequestContext.class.equals(parameter.getParameterType());
        }

        @Override
        public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                      NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
            String actorId = webRequest.getHeader(ACTOR_ID_HEADER);
            if (actorId == null || actorId.isBlank()) {
                throw new ValidationException("MISSING_ACTOR", "Header " + ACTOR_ID_HEADER + " is required");
            }
            String role = webRequest.getHeader(ACTOR_ROLE_HEADER);
            try {
                EmployeeRole parsedRole = role == null || role.isBlank()
                        ? EmployeeRole.EMPLOYEE
                        : EmployeeRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
                return new RequestContext(Long.valueOf(actorId.trim()), parsedRole);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("INVALID_ACTOR", "Invalid caller headers: " + actorId + "/" + role);
            }
        }
    }
}
