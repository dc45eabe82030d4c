package github.sarthakdev143.matte_embed.pool;

import github.sarthakdev143.matte_embed.model.EmbedTask;
import github.sarthakdev143.matte_embed.model.ProgressEvent;
import github.sarthakdev143.matte_embed.model.TaskOutcome;
import github.sarthakdev143.matte_embed.model.TimingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs embed tasks on a bounded set of worker threads.
 * <p>
 * Tasks are handed to the executor from the calling thread, never more than
 * {@link ExecutorConfig#workerCount()} at a time, and the cancellation token is checked before
 * every hand-off. Completed outcomes are consumed on the calling thread in completion order.
 * After cancellation no further task is started; tasks already running are allowed to finish.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final ExecutorConfig config;
    private final ThreadPoolTaskExecutor executor;

    public WorkerPool(ExecutorConfig config) {
        this.config = config;
        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.workerCount());
        executor.setMaxPoolSize(config.workerCount());
        executor.setQueueCapacity(config.workerCount());
        executor.setThreadNamePrefix(config.threadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(0);
        executor.initialize();
    }

    public PoolRunSummary execute(
            List<EmbedTask> tasks,
            TaskRunner runner,
            Consumer<TaskOutcome> outcomeConsumer,
            ProgressListener listener,
            CancellationToken cancellationToken) {
        int total = tasks.size();
        BlockingQueue<TaskOutcome> completions = new LinkedBlockingQueue<>();
        Iterator<EmbedTask> pending = tasks.iterator();
        long pollMillis = config.pollInterval().toMillis();
        long startNanos = System.nanoTime();
        int inFlight = 0;
        int processed = 0;
        boolean cancelled = false;

        while (processed < total) {
            while (inFlight < config.workerCount() && pending.hasNext() && !cancellationToken.isCancelled()) {
                EmbedTask task = pending.next();
                executor.execute(() -> runGuarded(task, runner, cancellationToken, completions));
                inFlight++;
            }

            if (cancellationToken.isCancelled()) {
                cancelled = true;
                break;
            }

            TaskOutcome outcome;
            try {
                outcome = completions.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellationToken.cancel();
                cancelled = true;
                break;
            }
            if (outcome == null) {
                continue;
            }

            inFlight--;
            processed++;
            outcomeConsumer.accept(outcome);
            publishProgress(listener, outcome, processed, total, startNanos);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        if (cancelled) {
            logger.info("Worker pool cancelled after {}/{} tasks; {} in flight allowed to finish", processed, total, inFlight);
            executor.shutdown();
        }
        return new PoolRunSummary(processed, total, cancelled, elapsed);
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private void runGuarded(
            EmbedTask task,
            TaskRunner runner,
            CancellationToken cancellationToken,
            BlockingQueue<TaskOutcome> completions) {
        if (cancellationToken.isCancelled()) {
            return;
        }

        TaskOutcome outcome;
        try {
            runner.run(task);
            outcome = TaskOutcome.succeeded(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = TaskOutcome.failed(task, "Interrupted");
        } catch (Exception e) {
            logger.warn("Embedding failed for {}", task.baseFile(), e);
            outcome = TaskOutcome.failed(task, e.getMessage());
        } catch (Error e) {
            completions.add(TaskOutcome.failed(task, e.toString()));
            throw e;
        }
        completions.add(outcome);
    }

    private void publishProgress(
            ProgressListener listener,
            TaskOutcome outcome,
            int processed,
            int total,
            long startNanos) {
        double percent = total == 0 ? 100.0 : processed * 100.0 / total;
        listener.onProgress(new ProgressEvent(
                processed,
                total,
                percent,
                "Processing: " + outcome.baseFolder().getFileName(),
                "Progress: " + processed + "/" + total + " files"));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        Duration average = elapsed.dividedBy(processed);
        Duration remaining = average.multipliedBy(total - processed);
        listener.onTiming(new TimingEvent(elapsed, average, remaining));
    }
}
