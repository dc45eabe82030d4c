package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.config.MatteEmbedProperties;
import github.sarthakdev143.matte_embed.factory.WorkerPoolFactory;
import github.sarthakdev143.matte_embed.model.EmbedJobState;
import github.sarthakdev143.matte_embed.model.EmbedJobStatus;
import github.sarthakdev143.matte_embed.model.EmbedTask;
import github.sarthakdev143.matte_embed.model.ProgressEvent;
import github.sarthakdev143.matte_embed.model.ReplacementOutcome;
import github.sarthakdev143.matte_embed.model.RunOptions;
import github.sarthakdev143.matte_embed.model.RunResult;
import github.sarthakdev143.matte_embed.model.ScanReport;
import github.sarthakdev143.matte_embed.model.TaskOutcome;
import github.sarthakdev143.matte_embed.model.TimingEvent;
import github.sarthakdev143.matte_embed.pool.CancellationToken;
import github.sarthakdev143.matte_embed.pool.ExecutorConfig;
import github.sarthakdev143.matte_embed.pool.PoolRunSummary;
import github.sarthakdev143.matte_embed.pool.ProgressListener;
import github.sarthakdev143.matte_embed.pool.WorkerPool;
import github.sarthakdev143.matte_embed.service.MatteEmbedException;
import github.sarthakdev143.matte_embed.service.MatteEmbedService;
import github.sarthakdev143.matte_embed.service.SequenceDiscoverer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Service
public class DefaultMatteEmbedService implements MatteEmbedService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMatteEmbedService.class);
    private static final String WORKER_THREAD_PREFIX = "matte-embed-worker-";

    private final SequenceDiscoverer sequenceDiscoverer;
    private final TaskPlanner taskPlanner;
    private final MatteEmbedder matteEmbedder;
    private final OriginalsReplacer originalsReplacer;
    private final ChannelNameResolver channelNameResolver;
    private final WorkerPoolFactory workerPoolFactory;
    private final TaskExecutor taskExecutor;
    private final MatteEmbedProperties properties;
    private final Map<String, EmbedJobStatus> jobs = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> cancellationTokens = new ConcurrentHashMap<>();
    private final Counter processedFilesCounter;
    private final Counter failedFilesCounter;
    private final Counter cancelledJobsCounter;
    private final Counter replacementFailureCounter;

    public DefaultMatteEmbedService(
            SequenceDiscoverer sequenceDiscoverer,
            TaskPlanner taskPlanner,
            MatteEmbedder matteEmbedder,
            OriginalsReplacer originalsReplacer,
            ChannelNameResolver channelNameResolver,
            WorkerPoolFactory workerPoolFactory,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry,
            MatteEmbedProperties properties) {
        this.sequenceDiscoverer = sequenceDiscoverer;
        this.taskPlanner = taskPlanner;
        this.matteEmbedder = matteEmbedder;
        this.originalsReplacer = originalsReplacer;
        this.channelNameResolver = channelNameResolver;
        this.workerPoolFactory = workerPoolFactory;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
        this.processedFilesCounter = meterRegistry.counter("matte_embed.files.processed");
        this.failedFilesCounter = meterRegistry.counter("matte_embed.files.failed");
        this.cancelledJobsCounter = meterRegistry.counter("matte_embed.jobs.cancelled");
        this.replacementFailureCounter = meterRegistry.counter("matte_embed.replacement.failures");
    }

    @Override
    public ScanReport scan(Path root) throws IOException {
        return sequenceDiscoverer.discover(root);
    }

    @Override
    public RunResult run(
            ScanReport report,
            RunOptions options,
            ProgressListener progressListener,
            CancellationToken cancellationToken) {
        channelNameResolver.validateBasename(options.matteChannelBasename());
        List<EmbedTask> tasks = taskPlanner.plan(report, options.compression(), options.matteChannelBasename());
        ResultAggregator aggregator = new ResultAggregator(report.warnings(), tasks.size());

        if (tasks.isEmpty()) {
            progressListener.onProgress(new ProgressEvent(0, 0, 100.0, "No sequences to process.", ""));
            return aggregator.complete(cancellationToken.isCancelled());
        }

        logger.info(
                "Embedding {} files from {} sequences workers={} compression={} matteChannel={} replaceOriginals={}",
                tasks.size(),
                report.totalSequences(),
                options.workerCount(),
                options.compression().toCodecValue(),
                options.matteChannelBasename(),
                options.replaceOriginals());

        PoolRunSummary summary;
        ExecutorConfig executorConfig = new ExecutorConfig(
                options.workerCount(),
                WORKER_THREAD_PREFIX,
                properties.pollInterval());
        try (WorkerPool pool = workerPoolFactory.create(executorConfig)) {
            summary = pool.execute(
                    tasks,
                    matteEmbedder::embed,
                    outcome -> recordOutcome(aggregator, outcome),
                    progressListener,
                    cancellationToken);
        } catch (RuntimeException e) {
            throw new MatteEmbedException("Processing failed: " + e.getMessage(), e);
        }

        RunResult result = aggregator.complete(summary.cancelled());
        logger.info(
                "Embedding finished status={} processed={}/{} errors={} warnings={} elapsed={}",
                result.status(),
                result.processedFiles(),
                result.totalFiles(),
                result.errorFiles().size(),
                result.warnings().size(),
                summary.elapsed());

        if (!options.replaceOriginals()) {
            return result;
        }
        if (!aggregator.replacementAllowed(summary.cancelled())) {
            logger.warn(
                    "Originals were not replaced: cancelled={} errors={} warnings={}",
                    summary.cancelled(),
                    result.errorFiles().size(),
                    result.warnings().size());
            return result;
        }

        ReplacementOutcome replacement = originalsReplacer.replace(report.groups());
        if (!replacement.errors().isEmpty()) {
            replacementFailureCounter.increment(replacement.errors().size());
        }
        return result.withReplacement(replacement.replacedFolders(), replacement.errors());
    }

    @Override
    public RunOptions defaultOptions() {
        return new RunOptions(
                properties.compression(),
                properties.defaultMatteChannel(),
                properties.defaultWorkers(),
                false);
    }

    @Override
    public String submitJob(Path root, RunOptions options) {
        String jobId = UUID.randomUUID().toString();
        CancellationToken cancellationToken = new CancellationToken();
        cancellationTokens.put(jobId, cancellationToken);

        Instant now = Instant.now();
        jobs.put(jobId, new EmbedJobStatus(
                jobId,
                EmbedJobState.QUEUED,
                "Job queued.",
                now,
                now,
                root.toString(),
                0,
                0,
                0.0,
                null,
                null,
                null,
                null,
                null));

        logger.info(
                "Accepted embed job {} root={} workers={} replaceOriginals={}",
                jobId,
                root,
                options.workerCount(),
                options.replaceOriginals());

        taskExecutor.execute(() -> processJob(jobId, root, options, cancellationToken));
        return jobId;
    }

    @Override
    public Optional<EmbedJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public boolean cancelJob(String jobId) {
        CancellationToken cancellationToken = cancellationTokens.get(jobId);
        if (cancellationToken == null) {
            return false;
        }
        cancellationToken.cancel();
        logger.info("Cancellation requested for embed job {}", jobId);
        return true;
    }

    private void processJob(String jobId, Path root, RunOptions options, CancellationToken cancellationToken) {
        try {
            updateJobState(jobId, EmbedJobState.SCANNING, "Scanning " + root + ".");
            ScanReport report = sequenceDiscoverer.discover(root);

            if (cancellationToken.isCancelled()) {
                markJobFinished(jobId, EmbedJobState.CANCELLED, "Job cancelled before processing.", null, report);
                cancelledJobsCounter.increment();
                return;
            }

            if (report.totalSequences() == 0) {
                markJobFinished(jobId, EmbedJobState.COMPLETED, "No sequences found to process.", null, report);
                return;
            }

            updateJobState(jobId, EmbedJobState.PROCESSING, "Embedding " + report.totalFiles() + " files.");
            RunResult result = run(report, options, new JobProgressListener(jobId), cancellationToken);

            switch (result.status()) {
                case SUCCESS -> markJobFinished(
                        jobId,
                        EmbedJobState.COMPLETED,
                        result.replaced()
                                ? "All files processed; " + result.replacedFolders().size() + " sequence(s) replaced."
                                : "All files processed successfully.",
                        result,
                        report);
                case COMPLETED_WITH_ISSUES -> markJobFinished(
                        jobId,
                        EmbedJobState.COMPLETED_WITH_ISSUES,
                        ResultAggregator.describeIssues(result),
                        result,
                        report);
                case CANCELLED -> {
                    cancelledJobsCounter.increment();
                    markJobFinished(jobId, EmbedJobState.CANCELLED, "Job cancelled.", result, report);
                }
            }
            logger.info("Completed embed job {} status={}", jobId, result.status());
        } catch (Exception e) {
            logger.error("Embed job {} failed", jobId, e);
            markJobFailed(jobId, "Processing failed: " + e.getMessage());
        } finally {
            cancellationTokens.remove(jobId);
        }
    }

    private void recordOutcome(ResultAggregator aggregator, TaskOutcome outcome) {
        aggregator.accept(outcome);
        processedFilesCounter.increment();
        if (outcome.isFailed()) {
            failedFilesCounter.increment();
        }
    }

    private void updateJobState(String jobId, EmbedJobState state, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new EmbedJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.rootFolder(),
                current.processedFiles(),
                current.totalFiles(),
                current.percent(),
                current.detailLine(),
                current.timingLine(),
                current.warnings(),
                current.errorFiles(),
                current.replacedFolders()));
    }

    private void markJobFinished(
            String jobId,
            EmbedJobState state,
            String message,
            RunResult result,
            ScanReport report) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new EmbedJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.rootFolder(),
                result == null ? current.processedFiles() : result.processedFiles(),
                result == null ? report.totalFiles() : result.totalFiles(),
                current.percent(),
                current.detailLine(),
                current.timingLine(),
                report.warnings(),
                result == null ? List.of() : result.errorFiles(),
                result == null
                        ? List.of()
                        : result.replacedFolders().stream().map(Path::toString).collect(Collectors.toList())));
    }

    private void markJobFailed(String jobId, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new EmbedJobStatus(
                current.jobId(),
                EmbedJobState.FAILED,
                message,
                current.createdAt(),
                Instant.now(),
                current.rootFolder(),
                current.processedFiles(),
                current.totalFiles(),
                current.percent(),
                current.detailLine(),
                current.timingLine(),
                current.warnings(),
                current.errorFiles(),
                current.replacedFolders()));
    }

    private final class JobProgressListener implements ProgressListener {

        private final String jobId;

        private JobProgressListener(String jobId) {
            this.jobId = jobId;
        }

        @Override
        public void onProgress(ProgressEvent event) {
            jobs.computeIfPresent(jobId, (ignored, current) -> new EmbedJobStatus(
                    current.jobId(),
                    current.state(),
                    event.statusLine(),
                    current.createdAt(),
                    Instant.now(),
                    current.rootFolder(),
                    event.processed(),
                    event.total(),
                    event.percent(),
                    event.detailLine(),
                    current.timingLine(),
                    current.warnings(),
                    current.errorFiles(),
                    current.replacedFolders()));
        }

        @Override
        public void onTiming(TimingEvent event) {
            jobs.computeIfPresent(jobId, (ignored, current) -> new EmbedJobStatus(
                    current.jobId(),
                    current.state(),
                    current.message(),
                    current.createdAt(),
                    Instant.now(),
                    current.rootFolder(),
                    current.processedFiles(),
                    current.totalFiles(),
                    current.percent(),
                    current.detailLine(),
                    event.describe(),
                    current.warnings(),
                    current.errorFiles(),
                    current.replacedFolders()));
        }
    }
}
