package com.labvault.api.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Set;

/**
 * Access log for API requests: method, URI, status and duration.
 * Server errors log at ERROR, client errors at WARN, mutating requests at INFO, the rest at DEBUG.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String START_TIME_ATTR = "requestStartTime";
    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.currentTimeMillis());
        if (log.isDebugEnabled()) {
            log.debug("Request: {} {} from {} (user: {})",
                    request.getMethod(), request.getRequestURI(), clientIp(request), request.getHeader("X-User-Id"));
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object startTime = request.getAttribute(START_TIME_ATTR);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : 0;

        int status = response.getStatus();
        String method = request.getMethod();
        String uri = request.getRequestURI();

        if (status >= 500) {
            log.error("Response: {} {} -> {} ({}ms){}", method, uri, status, duration,
                    ex != null ? " - " + ex.getMessage() : "");
        } else if (status >= 400) {
            log.warn("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
        } else if (MUTATING_METHODS.contains(method)) {
            log.info("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
        } else {
            log.debug("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
        }
    }

    private String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            // first entry is the client
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
