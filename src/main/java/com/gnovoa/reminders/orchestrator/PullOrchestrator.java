package com.gnovoa.reminders.orchestrator;

import com.gnovoa.reminders.dispatch.BroadcastDispatcher;
import com.gnovoa.reminders.dispatch.ReminderMessageFormatter;
import com.gnovoa.reminders.dispatch.SubscriptionRegistry;
import com.gnovoa.reminders.jobs.JobScheduler;
import com.gnovoa.reminders.jobs.SchedulerFaultException;
import com.gnovoa.reminders.model.Fixture;
import com.gnovoa.reminders.model.PlannedReminder;
import com.gnovoa.reminders.planner.DedupLedger;
import com.gnovoa.reminders.planner.ReminderPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * The fetch, plan, reserve, schedule cycle and its triggers.
 *
 * <p>Cycles are not serialized against each other: a manual pull may overlap the daily one. The
 * {@link DedupLedger} guarantees each reminder is still scheduled only once.
 */
public final class PullOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PullOrchestrator.class);

    public static final String DAILY_JOB = "autoday-pull";
    public static final String BOOT_JOB = "boot-pull";

    private final TodayFixtureCollector collector;
    private final ReminderPlanner planner;
    private final DedupLedger ledger;
    private final JobScheduler scheduler;
    private final SubscriptionRegistry subscriptions;
    private final BroadcastDispatcher dispatcher;
    private final ReminderMessageFormatter formatter;
    private final Clock clock;
    private final List<Integer> offsets;
    private final LocalTime dailyPullTime;

    public PullOrchestrator(
            TodayFixtureCollector collector,
            ReminderPlanner planner,
            DedupLedger ledger,
            JobScheduler scheduler,
            SubscriptionRegistry subscriptions,
            BroadcastDispatcher dispatcher,
            ReminderMessageFormatter formatter,
            Clock clock,
            List<Integer> offsets,
            LocalTime dailyPullTime
    ) {
        this.collector = collector;
        this.planner = planner;
        this.ledger = ledger;
        this.scheduler = scheduler;
        this.subscriptions = subscriptions;
        this.dispatcher = dispatcher;
        this.formatter = formatter;
        this.clock = clock;
        this.offsets = List.copyOf(offsets);
        this.dailyPullTime = dailyPullTime;
    }

    public PullReport pull() {
        LocalDate today = LocalDate.now(clock);
        var collected = collector.collect(today);

        int jobs = 0;
        for (List<Fixture> fixtures : collected.byCountry().values()) {
            for (Fixture f : fixtures) jobs += scheduleReminders(f);
        }
        int countries = collected.byCountry().size();

        boolean broadcast = false;
        if (jobs > 0 && !subscriptions.isEmpty()) {
            dispatcher.broadcast(formatter.summary(countries, jobs), subscriptions.snapshot());
            broadcast = true;
        }

        var report = new PullReport(today, countries, collected.leaguesFetched(), collected.leaguesFailed(), jobs, broadcast);
        log.info("Pull finished: {}", report);
        return report;
    }

    /** @return number of reminders newly scheduled for {@code fixture} */
    int scheduleReminders(Fixture fixture) {
        int scheduled = 0;
        for (PlannedReminder r : planner.plan(fixture, clock.instant(), offsets)) {
            if (!ledger.reserve(r.key())) continue;
            try {
                scheduler.schedule(r.deliverAt(), r.payload(), r.key().jobName());
                scheduled++;
            } catch (SchedulerFaultException e) {
                log.error("Ledger let a duplicate through for {}", r.key(), e);
            }
        }
        return scheduled;
    }

    /** Idempotent: an existing daily job is replaced. */
    public void enableDaily() {
        scheduler.cancelByName(DAILY_JOB);
        scheduler.scheduleDaily(dailyPullTime, this::runQuietly, DAILY_JOB);
    }

    public boolean disableDaily() {
        return scheduler.cancelByName(DAILY_JOB) > 0;
    }

    public boolean dailyEnabled() {
        return scheduler.hasActive(DAILY_JOB);
    }

    public LocalTime dailyPullTime() {
        return dailyPullTime;
    }

    public void scheduleBootPull(Duration delay) {
        scheduler.scheduleOnce(delay, this::runQuietly, BOOT_JOB);
        log.info("Boot pull in {}", delay);
    }

    private void runQuietly() {
        try {
            pull();
        } catch (RuntimeException e) {
            log.error("Scheduled pull failed", e);
        }
    }
}
