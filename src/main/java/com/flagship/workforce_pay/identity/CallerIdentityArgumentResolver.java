package com.flagship.workforce_pay.identity;

import com.flagship.workforce_pay.exception.ValidationException;
import com.flagship.workforce_pay.observability.CorrelationContext;
import org.slf4j.MDC;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CallerIdentity} controller parameters from the identity headers
 * set by the authenticating gateway. Credentials are never inspected here.
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) throws Exception {
        String rawId = webRequest.getHeader(USER_ID_HEADER);
        if (rawId == null || rawId.isBlank()) {
            throw new MissingRequestHeaderException(USER_ID_HEADER, parameter);
        }

        long userId;
        try {
            userId = Long.parseLong(rawId.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(USER_ID_HEADER + " must be a positive integer");
        }
        if (userId <= 0) {
            throw new ValidationException(USER_ID_HEADER + " must be a positive integer");
        }

        String role = webRequest.getHeader(USER_ROLE_HEADER);
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, Long.toString(userId));
        return new CallerIdentity(userId, role == null || role.isBlank() ? CallerIdentity.DEFAULT_ROLE : role.trim());
    }
}
