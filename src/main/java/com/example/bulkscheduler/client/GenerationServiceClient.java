package com.example.bulkscheduler.client;

import com.example.bulkscheduler.client.ClientModels.GenerationRequest;
import com.example.bulkscheduler.client.ClientModels.GenerationResponse;
import com.example.bulkscheduler.config.GenerationServiceProperties;
import com.example.bulkscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the content generation service.
 * <p>
 * Uses:
 * - WebClient for the HTTP call, blocking on the execution thread
 * - Resilience4j Circuit Breaker so a dead service fails fires fast
 * <p>
 * There is no retry here: a failed run waits for the job's next fire or a manual trigger.
 */
@Slf4j
@Component
public class GenerationServiceClient {

    public static final String SERVICE_NAME = "Generation Service";
    public static final String SOURCE_HEADER = "x-generation-source";

    private final WebClient webClient;
    private final GenerationServiceProperties properties;

    public GenerationServiceClient(@Qualifier("generationServiceWebClient") WebClient webClient,
                                   GenerationServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Run one automated bulk generation
     *
     * @param request The fully-resolved generation payload
     * @return The service's response, which may itself report failure
     * @throws ExternalServiceException on transport errors or non-2xx responses
     */
    @CircuitBreaker(name = "generationService", fallbackMethod = "generateFallback")
    public GenerationResponse generate(GenerationRequest request) {
        log.info("Calling Generation Service for job {} ('{}')", request.getScheduledJobId(), request.getScheduledJobName());

        try {
            var response = webClient.post()
                    .uri(properties.getGeneratePath())
                    .header(SOURCE_HEADER, properties.getSourceTag())
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(GenerationResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();

            if (response == null) {
                throw new ExternalServiceException(SERVICE_NAME, "Empty response from generation endpoint");
            }
            return response;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Generation call for job {} failed: {}", request.getScheduledJobId(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback for any failure; only an open circuit gets its own message
     */
    @SuppressWarnings("unused")
    private GenerationResponse generateFallback(GenerationRequest request, Exception e) {
        if (e instanceof CallNotPermittedException) {
            log.warn("Circuit breaker open for Generation Service, job: {}", request.getScheduledJobId());
            throw ExternalServiceException.circuitOpen(SERVICE_NAME, e);
        }
        if (e instanceof ExternalServiceException externalServiceException) {
            throw externalServiceException;
        }
        throw new ExternalServiceException(SERVICE_NAME, e);
    }
}
