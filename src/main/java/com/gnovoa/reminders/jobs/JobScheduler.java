package com.gnovoa.reminders.jobs;

import com.gnovoa.reminders.model.ReminderPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory timeline of one-shot and daily jobs.
 *
 * <p>A single timer thread tracks due times and hands each firing to a worker pool, so a slow
 * delivery never delays other jobs. A job leaves the active set before its callback runs; whoever
 * removes it first (firing or {@link #cancelByName}) wins, which makes one-shot firing
 * exactly-once.
 */
public final class JobScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final ReminderHandler handler;
    private final Clock clock;
    private final ScheduledExecutorService timer;
    private final ExecutorService workers;

    private final Map<Long, ActiveJob> active = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    public JobScheduler(ReminderHandler handler, Clock clock, int workerThreads) {
        this(handler, clock,
                Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "job-timer")),
                Executors.newFixedThreadPool(workerThreads, r -> daemon(r, "job-worker")));
    }

    JobScheduler(ReminderHandler handler, Clock clock, ScheduledExecutorService timer, ExecutorService workers) {
        this.handler = handler;
        this.clock = clock;
        this.timer = timer;
        this.workers = workers;
    }

    /**
     * Registers a reminder to be handed to the {@link ReminderHandler} at {@code deliverAt}.
     * Instants in the past fire as soon as possible.
     *
     * @throws SchedulerFaultException if a reminder with the same name is still active
     */
    public synchronized ScheduledJob schedule(Instant deliverAt, ReminderPayload payload, String name) {
        boolean duplicate = active.values().stream()
                .anyMatch(j -> j.kind == JobKind.REMINDER && j.name.equals(name));
        if (duplicate) throw new SchedulerFaultException("Reminder " + name + " is already scheduled");

        var job = new ActiveJob(ids.incrementAndGet(), name, JobKind.REMINDER, payload,
                () -> handler.onReminder(payload), null);
        register(job, deliverAt);
        log.debug("Scheduled reminder {} at {}", name, deliverAt);
        return job.view();
    }

    /** Runs {@code task} once after {@code delay}. */
    public synchronized ScheduledJob scheduleOnce(Duration delay, Runnable task, String name) {
        var job = new ActiveJob(ids.incrementAndGet(), name, JobKind.ONE_SHOT, null, task, null);
        register(job, clock.instant().plus(delay));
        return job.view();
    }

    /** Runs {@code task} every day at {@code time} in the scheduler clock's zone. */
    public synchronized ScheduledJob scheduleDaily(LocalTime time, Runnable task, String name) {
        var job = new ActiveJob(ids.incrementAndGet(), name, JobKind.DAILY, null, task, time);
        register(job, nextDailyRun(clock.instant(), time, clock.getZone()));
        log.info("Scheduled daily job {} at {} ({})", name, time, clock.getZone());
        return job.view();
    }

    /**
     * Removes every active job named {@code name}. Jobs already handed to a worker are not
     * affected.
     *
     * @return number of jobs removed, 0 when none matched
     */
    public synchronized int cancelByName(String name) {
        int removed = 0;
        for (ActiveJob job : List.copyOf(active.values())) {
            if (!job.name.equals(name)) continue;
            if (active.remove(job.id, job)) {
                job.cancelFuture();
                removed++;
            }
        }
        if (removed > 0) log.info("Cancelled {} job(s) named {}", removed, name);
        return removed;
    }

    public List<ScheduledJob> activeJobs() {
        return active.values().stream()
                .map(ActiveJob::view)
                .sorted(Comparator.comparing(ScheduledJob::nextFireAt).thenComparingLong(ScheduledJob::id))
                .toList();
    }

    public boolean hasActive(String name) {
        return active.values().stream().anyMatch(j -> j.name.equals(name));
    }

    @Override
    public void close() {
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static Instant nextDailyRun(Instant now, LocalTime time, ZoneId zone) {
        ZonedDateTime candidate = now.atZone(zone).toLocalDate().atTime(time).atZone(zone);
        if (!candidate.toInstant().isAfter(now)) candidate = candidate.plusDays(1);
        return candidate.toInstant();
    }

    private void register(ActiveJob job, Instant fireAt) {
        job.nextFireAt = fireAt;
        active.put(job.id, job);
        arm(job, fireAt);
    }

    private void arm(ActiveJob job, Instant fireAt) {
        long delayMs = Math.max(0, clock.instant().until(fireAt, ChronoUnit.MILLIS));
        job.nextFireAt = fireAt;
        job.future = timer.schedule(() -> fire(job), delayMs, TimeUnit.MILLISECONDS);
    }

    // timer thread
    private void fire(ActiveJob job) {
        if (job.kind == JobKind.DAILY) {
            synchronized (this) {
                if (active.get(job.id) != job) return;
                arm(job, nextDailyRun(clock.instant().plusSeconds(1), job.dailyTime, clock.getZone()));
            }
        } else if (!active.remove(job.id, job)) {
            return;
        }

        try {
            workers.execute(() -> runSafely(job));
        } catch (RejectedExecutionException e) {
            log.warn("Job {} dropped: scheduler is shutting down", job.name);
        }
    }

    private static void runSafely(ActiveJob job) {
        try {
            job.action.run();
        } catch (RuntimeException e) {
            log.error("Job {} failed", job.name, e);
        }
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    private static final class ActiveJob {
        final long id;
        final String name;
        final JobKind kind;
        final ReminderPayload payload;
        final Runnable action;
        final LocalTime dailyTime;

        volatile Instant nextFireAt;
        volatile ScheduledFuture<?> future;

        ActiveJob(long id, String name, JobKind kind, ReminderPayload payload, Runnable action, LocalTime dailyTime) {
            this.id = id;
            this.name = name;
            this.kind = kind;
            this.payload = payload;
            this.action = action;
            this.dailyTime = dailyTime;
        }

        ScheduledJob view() {
            return new ScheduledJob(id, name, kind, nextFireAt, payload);
        }

        void cancelFuture() {
            if (future != null) future.cancel(false);
        }
    }
}
