package lab.relay.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lab.relay.ratelimit.SlidingWindowRateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

/**
 * Per-client budget over every HTTP route, keyed by remote address.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ApiRateLimitFilter extends OncePerRequestFilter {

    private final SlidingWindowRateLimiter apiRateLimiter;
    private final ObjectMapper objectMapper;

    public ApiRateLimitFilter(@Qualifier("apiRateLimiter") SlidingWindowRateLimiter apiRateLimiter, ObjectMapper objectMapper) {
        this.apiRateLimiter = apiRateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (apiRateLimiter.admit(request.getRemoteAddr())) {
            filterChain.doFilter(request, response);
            return;
        }
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(apiRateLimiter.getWindowDuration().toSeconds()));
        objectMapper.writeValue(response.getOutputStream(), Map.of(
                "status", HttpStatus.TOO_MANY_REQUESTS.value(),
                "message", "Too many requests from this client, please try again later."
        ));
    }
}
