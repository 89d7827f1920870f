package lab.relay.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CLIENT_ID_HEADER = "X-Client-Id";
    public static final String MDC_CORRELATION_ID_KEY = "correlationId";
    public static final String MDC_CLIENT_ID_KEY = "clientId";
    public static final String MDC_USER_ID_KEY = "userId";

    private static final int MAX_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String correlationId = resolveOrGenerate(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(MDC_CORRELATION_ID_KEY, correlationId);
        MDC.put(MDC_CLIENT_ID_KEY, resolveClientId(request));
        MDC.put(MDC_USER_ID_KEY, resolveUserId(request));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_CORRELATION_ID_KEY);
            MDC.remove(MDC_CLIENT_ID_KEY);
            MDC.remove(MDC_USER_ID_KEY);
        }
    }

    private String resolveOrGenerate(String incoming) {
        if (incoming == null) {
            return UUID.randomUUID().toString();
        }
        String trimmed = incoming.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return trimmed;
    }

    // Relayers identify themselves by header; otherwise the remote address stands in.
    private String resolveClientId(HttpServletRequest request) {
        String header = request.getHeader(CLIENT_ID_HEADER);
        if (header != null && !header.isBlank() && header.length() <= MAX_ID_LENGTH) {
            return header.trim();
        }
        return request.getRemoteAddr();
    }

    private String resolveUserId(HttpServletRequest request) {
        String source = request.getParameter("sourceIdentity");
        return source == null || source.isBlank() ? "-" : source.trim();
    }
}
