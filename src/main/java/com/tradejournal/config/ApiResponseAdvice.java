package com.tradejournal.config;

import com.tradejournal.api.dto.response.ApiErrorResponse;
import com.tradejournal.api.dto.response.ApiResponse;
import com.tradejournal.service.OwnerResolver;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful {@code /api/**} responses in an {@link ApiResponse} tagged with the owner
 * the request acted for. Error bodies and actuator output pass through unchanged.
 */
@RestControllerAdvice(basePackages = "com.tradejournal.api.controller")
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private final OwnerResolver ownerResolver;

    public ApiResponseAdvice(OwnerResolver ownerResolver) {
        this.ownerResolver = ownerResolver;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }
        if (!request.getURI().getPath().startsWith("/api/")) {
            return body;
        }
        String owner = ownerResolver.resolve(request.getHeaders().getFirst(OwnerResolver.OWNER_HEADER));
        return ApiResponse.of(owner, body);
    }
}
