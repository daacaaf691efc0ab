package com.example.scanscheduler.client;

import com.example.scanscheduler.client.ScanTaskModels.ScanTaskRequest;
import com.example.scanscheduler.client.ScanTaskModels.ScanTaskResult;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to the component that actually performs scans.
 * <p>
 * The returned future completes once the scan has finished, with its
 * terminal result, or exceptionally
 * with a {@link com.example.scanscheduler.exception.ScanTaskException}.
 * Cancelling the future is a best-effort request to abandon the call.
 */
public interface ScanTaskClient {

    CompletableFuture<ScanTaskResult> submit(ScanTaskRequest request);
}
