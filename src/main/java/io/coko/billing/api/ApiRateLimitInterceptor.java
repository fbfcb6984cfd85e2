package io.coko.billing.api;

import io.coko.billing.ratelimit.BillingRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Global request budget for the management API. Webhooks have their own per-provider budget.
 */
@Component
public class ApiRateLimitInterceptor implements HandlerInterceptor {

    private final BillingRateLimiter rateLimiter;

    public ApiRateLimitInterceptor(BillingRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (rateLimiter.tryConsumeApi()) {
            response.setHeader("X-RateLimit-Remaining", String.valueOf(rateLimiter.getRemainingApiTokens()));
            return true;
        }
        response.setStatus(429);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"error\":\"rate_limited\",\"retryAfter\":\"1 minute\"}");
        return false;
    }
}
