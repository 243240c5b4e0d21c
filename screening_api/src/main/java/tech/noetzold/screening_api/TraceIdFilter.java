package tech.noetzold.screening_api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a trace_id into the MDC for the whole request, taken from {@code X-Request-Id} when the
 * caller sends one, and echoes it back.
 */
@Component
@Order(1)
public class TraceIdFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(TraceIdFilter.class);

    static final String HEADER = "X-Request-Id";

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) req;
        String traceId = httpRequest.getHeader(HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = "req_" + UUID.randomUUID();
        }

        long startTime = System.currentTimeMillis();
        MDC.put("trace_id", traceId);
        try {
            if (res instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(HEADER, traceId);
            }
            chain.doFilter(req, res);
        } finally {
            logger.debug("{} {} handled in {} ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    System.currentTimeMillis() - startTime);
            MDC.remove("trace_id");
        }
    }
}
