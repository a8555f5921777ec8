package com.platform.netconfig.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.netconfig.controller.ControllerClient;
import com.platform.netconfig.controller.RateLimitedControllerClient;
import com.platform.netconfig.controller.RetryingControllerClient;
import com.platform.netconfig.controller.unifi.ControllerModelMapper;
import com.platform.netconfig.controller.unifi.UniFiControllerClient;
import com.platform.netconfig.error.TransientApiException;
import com.platform.netconfig.observability.ReconciliationMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the controller client: HTTP client, then rate limiter, then retry.
 * Each retry attempt takes its own rate-limit token.
 */
@Slf4j
@Configuration
public class ControllerClientConfig {
    
    public static final String RETRY_NAME = "controller";
    
    @Bean
    public RetryRegistry controllerRetryRegistry(NetConfigProperties properties) {
        NetConfigProperties.Retry retry = properties.getController().getRetry();
        
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(Math.max(retry.getMaxAttempts(), 1))
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                retry.getInitialDelay().toMillis(),
                retry.getMultiplier(),
                retry.getMaxDelay().toMillis()))
            .retryOnException(e -> e instanceof TransientApiException)
            .build();
        
        log.info("Controller retry: {} attempts, backoff {}ms x{} up to {}ms",
            retry.getMaxAttempts(), retry.getInitialDelay().toMillis(),
            retry.getMultiplier(), retry.getMaxDelay().toMillis());
        return RetryRegistry.of(config);
    }
    
    @Bean
    public ControllerClient controllerClient(
            NetConfigProperties properties,
            ObjectMapper objectMapper,
            ControllerModelMapper modelMapper,
            RetryRegistry controllerRetryRegistry,
            ReconciliationMetrics metrics) {
        
        NetConfigProperties.Controller controller = properties.getController();
        ObjectMapper wireMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        
        ControllerClient client = new UniFiControllerClient(controller, wireMapper, modelMapper, metrics);
        
        NetConfigProperties.RateLimit rateLimit = controller.getRateLimit();
        if (rateLimit.isEnabled()) {
            client = new RateLimitedControllerClient(client,
                RateLimitedControllerClient.bucket(rateLimit.getRequestsPerSecond(), rateLimit.getBurst()));
        }
        
        Retry retry = controllerRetryRegistry.retry(RETRY_NAME);
        log.info("Controller client configured for {} (site {})", controller.getUrl(), controller.getSite());
        return new RetryingControllerClient(client, retry, metrics);
    }
}
