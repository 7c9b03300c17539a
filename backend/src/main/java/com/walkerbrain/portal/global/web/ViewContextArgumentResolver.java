package com.walkerbrain.portal.global.web;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.walkerbrain.portal.global.security.SecurityUtils;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

@Component
public class ViewContextArgumentResolver implements HandlerMethodArgumentResolver {

    private final Clock clock;

    public ViewContextArgumentResolver(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ViewContext.class.equals(parameter.getParameterType());
    }

    @Override
    public ViewContext resolveArgument(MethodParameter parameter,
                                       ModelAndViewContainer mavContainer,
                                       NativeWebRequest webRequest,
                                       WebDataBinderFactory binderFactory) {
        Object requestId = webRequest.getAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        return new ViewContext(
                SecurityUtils.getCurrentPrincipal(),
                requestId != null ? requestId.toString() : null,
                OffsetDateTime.now(clock)
        );
    }
}
