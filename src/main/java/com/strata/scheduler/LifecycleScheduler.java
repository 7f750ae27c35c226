package com.strata.scheduler;

import com.strata.backup.BackupService;
import com.strata.backup.RecoveryAttempt;
import com.strata.config.LifecycleProperties;
import com.strata.domain.AlertSeverity;
import com.strata.error.ErrorCategory;
import com.strata.error.ErrorSummaries;
import com.strata.error.JobTimeoutException;
import com.strata.error.LifecycleException;
import com.strata.error.NotFoundException;
import com.strata.error.ResourceBusyException;
import com.strata.history.BoundedHistory;
import com.strata.history.OperationResult;
import com.strata.metrics.LifecycleMetrics;
import com.strata.monitor.AlertRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Coordinates all lifecycle work.
 *
 * A single loop thread sleeps until the earliest due job and hands due jobs to
 * the dispatcher pool. The dispatcher takes the per-type lock and the shared
 * exclusion lock (write side for destructive types, read side otherwise), then
 * runs the job body on the worker pool with a timeout and bounded retries.
 * Exclusive work submitted by callers (restore, policy changes) takes the same
 * locks and the same timed, retried path.
 *
 * Status and history reads never touch the exclusion lock.
 */
@Component
public class LifecycleScheduler {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleScheduler.class);

    public static final String ALERT_SOURCE = "scheduler";

    private static final long IDLE_WAIT_MILLIS = 60_000;

    private final Map<JobType, LifecycleJob> jobs = new EnumMap<>(JobType.class);
    private final Map<JobType, ScheduledJob> schedule = new EnumMap<>(JobType.class);
    private final Map<JobType, ReentrantLock> typeLocks = new EnumMap<>(JobType.class);
    private final Map<JobType, BoundedHistory<OperationResult>> histories = new EnumMap<>(JobType.class);

    /**
     * Destructive jobs exclude everything else; fair so a waiting restore is not starved by readers
     */
    private final ReentrantReadWriteLock exclusion = new ReentrantReadWriteLock(true);

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition wakeUp = stateLock.newCondition();

    private final BackupService backupService;
    private final AlertRegistry alerts;
    private final SchedulerStateRepository stateRepository;
    private final LifecycleProperties.Scheduler config;
    private final AsyncTaskExecutor dispatcher;
    private final AsyncTaskExecutor workers;
    private final Clock clock;
    private final LifecycleMetrics metrics;
    private final RetryConfig retryConfig;

    private volatile boolean running;
    private Thread loopThread;

    public LifecycleScheduler(List<LifecycleJob> lifecycleJobs, BackupService backupService, AlertRegistry alerts,
                              SchedulerStateRepository stateRepository, LifecycleProperties properties,
                              @Qualifier("lifecycleDispatcher") AsyncTaskExecutor dispatcher,
                              @Qualifier("lifecycleWorkers") AsyncTaskExecutor workers,
                              Clock clock, LifecycleMetrics metrics) {
        this.backupService = backupService;
        this.alerts = alerts;
        this.stateRepository = stateRepository;
        this.config = properties.getScheduler();
        this.dispatcher = dispatcher;
        this.workers = workers;
        this.clock = clock;
        this.metrics = metrics;

        for (JobType type : JobType.values()) {
            typeLocks.put(type, new ReentrantLock());
            histories.put(type, new BoundedHistory<>(properties.getHistoryCapacity()));
        }

        Map<JobType, Instant> lastRuns = stateRepository.load();
        Instant now = clock.instant();
        for (LifecycleJob job : lifecycleJobs) {
            Duration interval = config.getIntervals().get(job.type());
            if (!job.type().isPeriodic() || interval == null) {
                logger.warn("Job {} has no interval configured and will not be scheduled", job.type());
                continue;
            }
            jobs.put(job.type(), job);
            schedule.put(job.type(), new ScheduledJob(job.type(), interval, lastRuns.get(job.type()), now));
        }

        this.retryConfig = RetryConfig.custom()
            .maxAttempts(config.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                config.getInitialBackoff(), config.getBackoffMultiplier(), config.getMaxBackoff()))
            .retryOnException(e -> ErrorSummaries.categorize(e).isRetryable())
            .build();
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            start();
        } else {
            logger.info("Lifecycle scheduler disabled; jobs run only when triggered");
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::loop, "lifecycle-scheduler");
        loopThread.setDaemon(true);
        loopThread.start();
        logger.info("Lifecycle scheduler started with jobs {}", schedule.keySet());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        signal();
        try {
            loopThread.join(TimeUnit.SECONDS.toMillis(10));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Lifecycle scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void loop() {
        while (running) {
            try {
                awaitNextDue();
                if (running) {
                    runDueJobs();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                logger.error("Scheduler loop iteration failed", e);
            }
        }
    }

    private void awaitNextDue() throws InterruptedException {
        stateLock.lock();
        try {
            while (running) {
                Instant now = clock.instant();
                Optional<Instant> next = schedule.values().stream()
                    .filter(job -> job.getState() != JobState.DUE && job.getState() != JobState.RUNNING)
                    .map(ScheduledJob::getNextDueAt)
                    .min(Instant::compareTo);
                if (next.isPresent() && !next.get().isAfter(now)) {
                    return;
                }
                long waitMillis = next.map(at -> Duration.between(now, at).toMillis()).orElse(IDLE_WAIT_MILLIS);
                wakeUp.await(Math.max(1, waitMillis), TimeUnit.MILLISECONDS);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Dispatch every job that is due now.
     *
     * @return one future per dispatched job, completing when the job has finished
     */
    public List<Future<?>> runDueJobs() {
        List<JobType> due = new ArrayList<>();
        stateLock.lock();
        try {
            Instant now = clock.instant();
            for (ScheduledJob job : schedule.values()) {
                if (job.isDue(now)) {
                    job.setState(JobState.DUE);
                    due.add(job.getJobType());
                }
            }
        } finally {
            stateLock.unlock();
        }

        List<Future<?>> dispatched = new ArrayList<>();
        for (JobType type : due) {
            try {
                dispatched.add(dispatcher.submit(() -> execute(type)));
            } catch (TaskRejectedException e) {
                logger.warn("Dispatcher rejected {}, will retry on the next cycle", type);
                withState(() -> schedule.get(type).setState(JobState.IDLE));
            }
        }
        return dispatched;
    }

    /**
     * Make a periodic job due now.
     *
     * @return false if the job is already queued or running
     */
    public boolean trigger(JobType type) {
        if (!type.isPeriodic()) {
            throw new IllegalArgumentException(type + " cannot be triggered directly");
        }
        boolean accepted;
        stateLock.lock();
        try {
            ScheduledJob job = schedule.get(type);
            if (job == null) {
                throw new NotFoundException("job", type.name());
            }
            accepted = job.getState() != JobState.DUE && job.getState() != JobState.RUNNING;
            if (accepted) {
                job.setNextDueAt(clock.instant());
                wakeUp.signalAll();
            }
        } finally {
            stateLock.unlock();
        }
        logger.info("Triggered {} (accepted={})", type, accepted);
        if (accepted && !running) {
            runDueJobs();
        }
        return accepted;
    }

    /**
     * Restore a backup under the write side of the exclusion lock, so no
     * cleanup or archive can interleave with it.
     */
    public RecoveryAttempt triggerRestore(String backupId) {
        return runExclusive(JobType.RESTORE, context -> backupService.restore(backupId, context));
    }

    /**
     * Run {@code action} under the per-type lock and the exclusion lock side of
     * {@code type}, recording the outcome in that type's history. The caller
     * blocks while the action runs on the worker pool with the job timeout and
     * the same bounded retries as periodic jobs.
     *
     * @throws ResourceBusyException if the locks are not acquired within the lock wait timeout
     * @throws JobTimeoutException if the last attempt timed out
     */
    public <T> T runExclusive(JobType type, Function<JobContext, T> action) {
        Instant startedAt = clock.instant();
        ReentrantLock typeLock = typeLocks.get(type);
        if (!acquire(typeLock)) {
            throw busy(type);
        }
        try {
            Lock side = exclusionSide(type);
            if (!acquire(side)) {
                throw busy(type);
            }
            try {
                T value = callWithRetry(type, action);
                OperationResult result;
                if (value instanceof OperationResult) {
                    result = (OperationResult) value;
                } else {
                    result = new OperationResult(operationName(type), startedAt);
                    result.succeed(clock.instant());
                }
                record(type, result);
                return value;
            } catch (RuntimeException e) {
                OperationResult failed = new OperationResult(operationName(type), startedAt);
                failed.fail(clock.instant(), e);
                record(type, failed);
                ErrorCategory category = ErrorSummaries.categorize(e);
                if (category == ErrorCategory.INTEGRITY_VIOLATION || category.isRetryable()) {
                    raiseJobAlert(type, failed.getErrorSummary());
                }
                throw e;
            } finally {
                side.unlock();
            }
        } finally {
            typeLock.unlock();
        }
    }

    private void execute(JobType type) {
        Instant startedAt = clock.instant();
        ReentrantLock typeLock = typeLocks.get(type);
        if (!acquire(typeLock)) {
            postpone(type, startedAt);
            return;
        }
        OperationResult result;
        try {
            Lock side = exclusionSide(type);
            if (!acquire(side)) {
                postpone(type, startedAt);
                return;
            }
            try {
                withState(() -> schedule.get(type).setState(JobState.RUNNING));
                logger.info("Running {}", type);
                result = runWithRetry(type, startedAt);
            } finally {
                side.unlock();
            }
        } finally {
            typeLock.unlock();
        }
        complete(type, startedAt, result);
    }

    private OperationResult runWithRetry(JobType type, Instant startedAt) {
        LifecycleJob job = jobs.get(type);
        try {
            return callWithRetry(type, job::run);
        } catch (RuntimeException e) {
            OperationResult failed = new OperationResult(operationName(type), startedAt);
            failed.fail(clock.instant(), e);
            raiseJobAlert(type, failed.getErrorSummary());
            return failed;
        }
    }

    private <T> T callWithRetry(JobType type, Function<JobContext, T> body) {
        Retry retry = Retry.of("lifecycle-" + type.name().toLowerCase(), retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            metrics.recordJobRetry(type.name());
            logger.warn("{} attempt {} failed, retrying in {}: {}", type, event.getNumberOfRetryAttempts(),
                event.getWaitInterval(), ErrorSummaries.summarize(event.getLastThrowable()));
        });

        AtomicInteger attempts = new AtomicInteger();
        Supplier<T> attempt = () -> runAttempt(type, attempts.incrementAndGet(), body);
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorSummaries.categorize(e);
            if (category == ErrorCategory.INVALID_POLICY || category == ErrorCategory.NOT_FOUND
                    || category == ErrorCategory.INVALID_QUERY) {
                logger.warn("{} rejected: {}", type, ErrorSummaries.summarize(e));
            } else {
                logger.error("{} failed after {} attempt(s): {}", type, attempts.get(), ErrorSummaries.summarize(e), e);
            }
            throw e;
        }
    }

    /**
     * One attempt on the worker pool. On timeout the job is cancelled
     * cooperatively and interrupted, and this method waits until the body has
     * actually returned so the exclusion lock is never released under it.
     */
    private <T> T runAttempt(JobType type, int attempt, Function<JobContext, T> body) {
        JobContext context = new JobContext(type, attempt);
        AtomicBoolean claimed = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);

        Future<T> future = workers.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            try {
                return body.apply(context);
            } finally {
                finished.countDown();
            }
        });

        Duration timeout = config.getJobTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            context.cancel();
            future.cancel(true);
            metrics.recordJobTimeout(type.name());
            awaitBody(type, claimed, finished);
            throw new JobTimeoutException(type.name(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new LifecycleException(ErrorCategory.INTERNAL, type + " failed", cause);
        } catch (InterruptedException e) {
            context.cancel();
            future.cancel(true);
            awaitBody(type, claimed, finished);
            Thread.currentThread().interrupt();
            throw new LifecycleException(ErrorCategory.INTERNAL, type + " was interrupted", e);
        }
    }

    private void awaitBody(JobType type, AtomicBoolean claimed, CountDownLatch finished) {
        if (claimed.compareAndSet(false, true)) {
            // never started and now never will
            return;
        }
        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    if (finished.await(30, TimeUnit.SECONDS)) {
                        return;
                    }
                    logger.warn("{} is still running after cancellation; holding its locks", type);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void complete(JobType type, Instant startedAt, OperationResult result) {
        Map<JobType, Instant> lastRuns = new EnumMap<>(JobType.class);
        stateLock.lock();
        try {
            schedule.get(type).completed(startedAt, result);
            for (ScheduledJob job : schedule.values()) {
                if (job.getLastRunAt() != null) {
                    lastRuns.put(job.getJobType(), job.getLastRunAt());
                }
            }
            wakeUp.signalAll();
        } finally {
            stateLock.unlock();
        }
        stateRepository.save(lastRuns);
        record(type, result);
        metrics.recordJobRun(type.name(), result.isSuccess(), Duration.between(startedAt, clock.instant()));
        if (result.isSuccess()) {
            alerts.resolve(alertCondition(type));
            logger.info("{} succeeded: {}", type, result);
        }
    }

    private void postpone(JobType type, Instant startedAt) {
        ResourceBusyException busy = busy(type);
        OperationResult result = new OperationResult(operationName(type), startedAt);
        result.fail(clock.instant(), busy);
        Instant retryAt = clock.instant().plus(config.getBusyRetryDelay());
        withState(() -> {
            schedule.get(type).postpone(retryAt, result);
            wakeUp.signalAll();
        });
        record(type, result);
        logger.info("{} postponed to {}: exclusion lock busy", type, retryAt);
    }

    private ResourceBusyException busy(JobType type) {
        metrics.recordJobBusy(type.name());
        return new ResourceBusyException(type.name());
    }

    private boolean acquire(Lock lock) {
        try {
            return lock.tryLock(config.getLockWaitTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Lock exclusionSide(JobType type) {
        return type.isDestructive() ? exclusion.writeLock() : exclusion.readLock();
    }

    private void raiseJobAlert(JobType type, String summary) {
        alerts.raise(alertCondition(type), AlertSeverity.CRITICAL,
            type.name().toLowerCase() + " failed: " + summary, null, ALERT_SOURCE);
    }

    static String alertCondition(JobType type) {
        return "job:" + type.name().toLowerCase();
    }

    private static String operationName(JobType type) {
        return type.name().toLowerCase();
    }

    private void record(JobType type, OperationResult result) {
        histories.get(type).append(result);
    }

    private void withState(Runnable mutation) {
        stateLock.lock();
        try {
            mutation.run();
        } finally {
            stateLock.unlock();
        }
    }

    private void signal() {
        withState(wakeUp::signalAll);
    }

    /**
     * Snapshot of every scheduled job.
     */
    public List<ScheduledJob> status() {
        List<ScheduledJob> snapshot = new ArrayList<>();
        withState(() -> schedule.values().forEach(job -> snapshot.add(job.snapshot())));
        return snapshot;
    }

    public List<OperationResult> history(JobType type) {
        return histories.get(type).snapshot();
    }
}
