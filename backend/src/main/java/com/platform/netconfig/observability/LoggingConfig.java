package com.platform.netconfig.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation ids for HTTP requests and MDC helpers
 * for run and operation context.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_MODE = "mode";
    public static final String MDC_OPERATION = "operation";
    public static final String MDC_TARGET = "target";
    
    @Value("${spring.application.name:netconfig}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    @ConditionalOnWebApplication
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Set run context in MDC for the duration of a reconciliation run.
     */
    public static void setRunContext(String runId, String mode) {
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_MODE, mode);
    }
    
    public static void clearRunContext() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_MODE);
    }
    
    /**
     * Set operation context for detailed logging.
     */
    public static void setOperationContext(String operation, String target) {
        MDC.put(MDC_OPERATION, operation);
        MDC.put(MDC_TARGET, target);
    }
    
    /**
     * Clear operation context.
     */
    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_TARGET);
    }
}
