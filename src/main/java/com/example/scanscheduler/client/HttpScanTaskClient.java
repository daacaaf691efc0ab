package com.example.scanscheduler.client;

import com.example.scanscheduler.client.ScanTaskModels.ScanTaskRequest;
import com.example.scanscheduler.client.ScanTaskModels.ScanTaskResult;
import com.example.scanscheduler.config.ScanServiceProperties;
import com.example.scanscheduler.exception.ScanTaskException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Client for the scan service API.
 * <p>
 * A scan is created with {@code POST /api/v1/scans}. Until the answer carries a
 * terminal status the scan is followed with {@code GET /api/v1/scans/{scanId}}
 * every poll interval. Each request has its own timeout; the scan as a whole
 * is bounded by the caller, who cancels the future to stop following it.
 * <p>
 * Uses:
 * - WebClient for the HTTP calls, run on the scan task executor
 * - Resilience4j Circuit Breaker so an unavailable scan service fails fast
 */
@Slf4j
@Component
public class HttpScanTaskClient implements ScanTaskClient {

    private static final String SCANS_PATH = "/api/v1/scans";

    private final WebClient webClient;
    private final Executor executor;
    private final Duration requestTimeout;
    private final Duration pollInterval;

    public HttpScanTaskClient(@Qualifier("scanServiceWebClient") WebClient webClient,
                              @Qualifier("scanTaskExecutor") Executor executor,
                              ScanServiceProperties properties) {
        this.webClient = webClient;
        this.executor = executor;
        this.requestTimeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        this.pollInterval = Duration.ofMillis(properties.getPollIntervalMs());
    }

    /**
     * Ask the scan service to run a scan
     *
     * @param request what to scan
     * @return future of the scan's terminal result
     */
    @Override
    @CircuitBreaker(name = "scanService", fallbackMethod = "submitFallback")
    public CompletableFuture<ScanTaskResult> submit(ScanTaskRequest request) {
        var future = new CompletableFuture<ScanTaskResult>();
        executor.execute(() -> {
            try {
                var created = createScan(request);
                future.complete(followScan(created, future));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private ScanTaskResult createScan(ScanTaskRequest request) {
        log.info("Calling Scan Service for domain {} (schedule {})", request.getDomain(), request.getScheduleId());

        try {
            var result = webClient.post()
                    .uri(SCANS_PATH)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, HttpScanTaskClient::toScanTaskException)
                    .bodyToMono(ScanTaskResult.class)
                    .timeout(requestTimeout)
                    .block();
            if (result == null) {
                throw new ScanTaskException("Scan service returned an empty response");
            }
            return result;
        } catch (ScanTaskException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to submit scan for {}: {}", request.getDomain(), e.getMessage());
            throw new ScanTaskException("Scan service call failed: " + e.getMessage(), e);
        }
    }

    /**
     * Poll until the scan reaches a terminal status or the caller gives up.
     * A cancelled caller gets the last answer seen, which nobody reads.
     */
    private ScanTaskResult followScan(ScanTaskResult created, CompletableFuture<ScanTaskResult> caller) {
        if (created.isTerminal()) {
            return created;
        }
        if (created.getScanId() == null) {
            throw new ScanTaskException("Scan service accepted the scan with status "
                    + created.getStatus() + " but returned no scan id to follow");
        }

        log.debug("Scan {} is {}, polling every {}ms", created.getScanId(), created.getStatus(), pollInterval.toMillis());
        var current = created;
        while (!caller.isDone()) {
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ScanTaskException("Interrupted while following scan " + created.getScanId(), e);
            }
            if (caller.isDone()) {
                break;
            }
            current = fetchScan(created.getScanId());
            if (current.isTerminal()) {
                log.info("Scan {} finished with status {}", current.getScanId(), current.getStatus());
                return current;
            }
        }
        return current;
    }

    private ScanTaskResult fetchScan(String scanId) {
        try {
            var result = webClient.get()
                    .uri(SCANS_PATH + "/{scanId}", scanId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, HttpScanTaskClient::toScanTaskException)
                    .bodyToMono(ScanTaskResult.class)
                    .timeout(requestTimeout)
                    .block();
            if (result == null) {
                throw new ScanTaskException("Scan service returned an empty status for scan " + scanId);
            }
            if (result.getScanId() == null) {
                result.setScanId(scanId);
            }
            return result;
        } catch (ScanTaskException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to read status of scan {}: {}", scanId, e.getMessage());
            throw new ScanTaskException("Scan service call failed: " + e.getMessage(), e);
        }
    }

    private static Mono<? extends Throwable> toScanTaskException(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new ScanTaskException(response.statusCode().value(), body)));
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private CompletableFuture<ScanTaskResult> submitFallback(ScanTaskRequest request, Throwable e) {
        log.warn("Circuit breaker open for Scan Service, domain: {}, error: {}", request.getDomain(), e.getMessage());
        var error = e instanceof ScanTaskException scanTaskException
                ? scanTaskException
                : new ScanTaskException("Scan service temporarily unavailable (circuit breaker open)", e);
        return CompletableFuture.failedFuture(error);
    }
}
