package com.id.pibridge.modules.query.service;

import com.id.pibridge.config.AppConfig;
import com.id.pibridge.model.PiDataFrame;
import com.id.pibridge.model.PiQueryDataReq;
import com.id.pibridge.model.PiQueryDataRes;
import com.id.pibridge.modules.batch.model.BatchResponse;
import com.id.pibridge.modules.batch.model.BatchSubRequest;
import com.id.pibridge.modules.batch.service.BatchOrchestrator;
import com.id.pibridge.modules.frame.logic.FrameAssembler;
import com.id.pibridge.modules.query.logic.PiQueryModes;
import com.id.pibridge.modules.query.logic.QueryUriBuilder;
import com.id.pibridge.modules.query.logic.TargetPathParser;
import com.id.pibridge.modules.query.model.PiQuery;
import com.id.pibridge.modules.query.model.ProcessedQuery;
import com.id.pibridge.modules.webapi.service.PiWebApiClient;
import com.id.pibridge.modules.webid.service.WebIdResolver;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Query pipeline: expand targets, resolve WebIDs, one batch call per RefID, then frames.
 * <p>
 * Resolutions and batch calls run on a bounded worker pool. Their results are only written back on the calling
 * thread, and whatever is not done when the request deadline passes is cancelled and reported as unresolved.
 */
@Service
@Slf4j
public class QueryDataService {

    private final AppConfig appConfig;
    private final PiWebApiClient piWebApiClient;
    private final WebIdResolver webIdResolver;
    private final BatchOrchestrator batchOrchestrator;
    private final FrameAssembler frameAssembler;
    private final ExecutorService executor;

    public QueryDataService(AppConfig appConfig,
                            PiWebApiClient piWebApiClient,
                            WebIdResolver webIdResolver,
                            BatchOrchestrator batchOrchestrator,
                            FrameAssembler frameAssembler) {
        this.appConfig = appConfig;
        this.piWebApiClient = piWebApiClient;
        this.webIdResolver = webIdResolver;
        this.batchOrchestrator = batchOrchestrator;
        this.frameAssembler = frameAssembler;

        int threads = Math.max(1, appConfig.getQueryWorkerThreads());
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(1, appConfig.getQueryQueueSize())),
                new CustomizableThreadFactory("pibridge-query-"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public PiQueryDataRes queryData(PiQueryDataReq req) {
        if (req == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        if (req.getQueries() == null || req.getQueries().isEmpty()) {
            throw new IllegalArgumentException("Queries cannot be null or empty");
        }
        if (req.getQueries().stream().anyMatch(q -> q == null || !StringUtils.hasText(q.getRefId()))) {
            throw new IllegalArgumentException("Every query needs a RefID");
        }

        String datasourceUid = StringUtils.hasText(req.getDatasourceUid())
                ? req.getDatasourceUid()
                : appConfig.getDatasourceUid();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(appConfig.getQueryTimeoutMs());

        // Turn each query into one entry per target
        Map<String, List<ProcessedQuery>> processedByRefId = new LinkedHashMap<>();
        List<Resolution> resolutions = new ArrayList<>();
        for (PiQuery query : req.getQueries()) {
            var processed = expand(query, datasourceUid);
            processedByRefId.put(query.getRefId(), processed);
            for (ProcessedQuery entry : processed) {
                if (entry.getFailure() == null && !entry.isResolved()) {
                    submitResolution(query, entry, resolutions);
                }
            }
        }

        awaitResolutions(resolutions, deadline);
        executeBatches(processedByRefId, deadline);

        Map<String, List<PiDataFrame>> responses = new LinkedHashMap<>();
        processedByRefId.forEach((refId, processed) -> responses.put(refId, frameAssembler.assemble(refId, processed)));
        return PiQueryDataRes.builder().responses(responses).build();
    }

    List<ProcessedQuery> expand(PiQuery query, String datasourceUid) {
        var options = PiQueryModes.options(query);
        var basePath = TargetPathParser.getBasePath(options.getTarget());
        var leaves = TargetPathParser.getTargets(options.getTarget());
        var timeRangeError = validateTimeRange(query);

        List<ProcessedQuery> processed = new ArrayList<>();
        if (leaves.isEmpty() && PiQueryModes.isExpression(options)) {
            // Calculation with no target: evaluated without a WebID context
            var entry = newEntry(query, datasourceUid, options.getExpression(), null);
            entry.setStreamable(false);
            if (timeRangeError != null) {
                entry.setFailure(timeRangeError);
            } else {
                entry.setBatchRequest(BatchSubRequest.get(piWebApiClient.getBaseUrl() + QueryUriBuilder.buildQueryUri(query)));
            }
            processed.add(entry);
            return processed;
        }

        for (String leaf : leaves) {
            var entry = newEntry(query, datasourceUid, leaf, TargetPathParser.fullPath(basePath, leaf, options.isPiPoint()));
            entry.setFailure(timeRangeError);
            processed.add(entry);
        }
        return processed;
    }

    private ProcessedQuery newEntry(PiQuery query, String datasourceUid, String label, String fullTargetPath) {
        var options = PiQueryModes.options(query);
        return ProcessedQuery.builder()
                .label(label)
                .fullTargetPath(fullTargetPath)
                .datasourceUid(datasourceUid)
                .piPoint(options.isPiPoint())
                .streamable(PiQueryModes.isStreamable(query))
                .digitalStates(PiQueryModes.isDigitalStates(options))
                .intervalNanoSeconds(TimeUnit.MILLISECONDS.toNanos(query.getIntervalMs()))
                .build();
    }

    private static String validateTimeRange(PiQuery query) {
        var range = query.getTimeRange();
        if (range == null || range.getFrom() == null || range.getTo() == null) {
            return "Query %s has no time range".formatted(query.getRefId());
        }
        return null;
    }

    private void submitResolution(PiQuery query, ProcessedQuery entry, List<Resolution> resolutions) {
        try {
            resolutions.add(new Resolution(query, entry, executor.submit(
                    () -> webIdResolver.resolve(entry.getFullTargetPath(), entry.isPiPoint()))));
        } catch (RejectedExecutionException e) {
            log.warn("Query pool is full, not resolving {}", entry.getFullTargetPath());
            entry.setFailure("Query pool is full, could not resolve " + entry.getFullTargetPath());
        }
    }

    private void awaitResolutions(List<Resolution> resolutions, long deadline) {
        for (Resolution resolution : resolutions) {
            var entry = resolution.entry();
            try {
                String webId = resolution.future().get(remaining(deadline), TimeUnit.NANOSECONDS);
                entry.setWebId(webId);
                entry.setBatchRequest(BatchSubRequest.get(
                        QueryUriBuilder.buildResource(piWebApiClient.getBaseUrl(), resolution.query(), webId)));
            } catch (ExecutionException e) {
                var cause = e.getCause() == null ? e : e.getCause();
                log.warn("Error getting WebID for {}: {}", entry.getFullTargetPath(), cause.getMessage());
                entry.setFailure(cause.getMessage());
            } catch (TimeoutException e) {
                resolution.future().cancel(true);
                log.warn("Timed out getting WebID for {}", entry.getFullTargetPath());
                entry.setFailure("Timed out resolving " + entry.getFullTargetPath());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                resolution.future().cancel(true);
                entry.setFailure("Interrupted while resolving " + entry.getFullTargetPath());
            }
        }
    }

    private void executeBatches(Map<String, List<ProcessedQuery>> processedByRefId, long deadline) {
        Map<String, Future<Map<Integer, BatchResponse>>> calls = new LinkedHashMap<>();
        processedByRefId.forEach((refId, processed) -> {
            if (processed.stream().noneMatch(ProcessedQuery::isResolved)) {
                return;
            }
            try {
                calls.put(refId, executor.submit(() -> batchOrchestrator.executeRefId(refId, processed)));
            } catch (RejectedExecutionException e) {
                log.warn("Query pool is full, skipping batch request of RefID {}", refId);
                BatchOrchestrator.markFailed(processed, "Query pool is full, batch request not sent");
            }
        });

        calls.forEach((refId, call) -> {
            var processed = processedByRefId.get(refId);
            try {
                BatchOrchestrator.apply(processed, call.get(remaining(deadline), TimeUnit.NANOSECONDS));
            } catch (ExecutionException e) {
                var cause = e.getCause() == null ? e : e.getCause();
                log.error("Error in batch request for RefID {}", refId, cause);
                BatchOrchestrator.markFailed(processed, cause.getMessage());
            } catch (TimeoutException e) {
                call.cancel(true);
                log.warn("Timed out waiting for batch request of RefID {}", refId);
                BatchOrchestrator.markFailed(processed, "Timed out waiting for batch response");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.cancel(true);
                BatchOrchestrator.markFailed(processed, "Interrupted while waiting for batch response");
            }
        });
    }

    private static long remaining(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    private record Resolution(PiQuery query, ProcessedQuery entry, Future<String> future) {
    }
}
