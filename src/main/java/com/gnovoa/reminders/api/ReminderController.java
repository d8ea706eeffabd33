package com.gnovoa.reminders.api;

import com.gnovoa.reminders.api.dto.ActiveJobResponse;
import com.gnovoa.reminders.api.dto.CancelResponse;
import com.gnovoa.reminders.api.dto.DailyPullResponse;
import com.gnovoa.reminders.api.dto.SubscriptionResponse;
import com.gnovoa.reminders.dispatch.SubscriptionRegistry;
import com.gnovoa.reminders.jobs.JobScheduler;
import com.gnovoa.reminders.jobs.ScheduledJob;
import com.gnovoa.reminders.orchestrator.LeagueCache;
import com.gnovoa.reminders.orchestrator.PullOrchestrator;
import com.gnovoa.reminders.orchestrator.PullReport;
import com.gnovoa.reminders.orchestrator.TodayDigest;
import com.gnovoa.reminders.orchestrator.TodayDigestService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api")
public class ReminderController {

    private final SubscriptionRegistry subscriptions;
    private final PullOrchestrator orchestrator;
    private final JobScheduler scheduler;
    private final TodayDigestService digest;
    private final LeagueCache leagues;
    private final Clock clock;

    public ReminderController(
            SubscriptionRegistry subscriptions,
            PullOrchestrator orchestrator,
            JobScheduler scheduler,
            TodayDigestService digest,
            LeagueCache leagues,
            Clock clock) {
        this.subscriptions = subscriptions;
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.digest = digest;
        this.leagues = leagues;
        this.clock = clock;
    }

    @PostMapping("/subscribers/{chatId}")
    public SubscriptionResponse subscribe(@PathVariable long chatId) {
        boolean changed = subscriptions.subscribe(chatId);
        return new SubscriptionResponse(chatId, true, changed, subscriptions.size());
    }

    @DeleteMapping("/subscribers/{chatId}")
    public SubscriptionResponse unsubscribe(@PathVariable long chatId) {
        boolean changed = subscriptions.unsubscribe(chatId);
        return new SubscriptionResponse(chatId, false, changed, subscriptions.size());
    }

    @GetMapping("/subscribers")
    public List<Long> subscribers() {
        return subscriptions.snapshot();
    }

    @PostMapping("/pulls")
    public PullReport pull() {
        return orchestrator.pull();
    }

    @PostMapping("/daily-pull/enable")
    public DailyPullResponse enableDaily() {
        orchestrator.enableDaily();
        return dailyStatus();
    }

    @PostMapping("/daily-pull/disable")
    public DailyPullResponse disableDaily() {
        orchestrator.disableDaily();
        return dailyStatus();
    }

    @GetMapping("/daily-pull")
    public DailyPullResponse dailyStatus() {
        var next = scheduler.activeJobs().stream()
                .filter(j -> j.name().equals(PullOrchestrator.DAILY_JOB))
                .map(ScheduledJob::nextFireAt)
                .findFirst()
                .orElse(null);
        return new DailyPullResponse(next != null, orchestrator.dailyPullTime(), clock.getZone().getId(), next);
    }

    @GetMapping("/jobs")
    public List<ActiveJobResponse> jobs() {
        return scheduler.activeJobs().stream().map(ReminderController::toResponse).toList();
    }

    @DeleteMapping("/jobs/{name}")
    public CancelResponse cancel(@PathVariable String name) {
        return new CancelResponse(name, scheduler.cancelByName(name));
    }

    @GetMapping("/fixtures/today")
    public TodayDigest today() {
        return digest.digest();
    }

    @PostMapping("/leagues/refresh")
    public ResponseEntity<Void> refreshLeagues() {
        leagues.invalidate();
        return ResponseEntity.accepted().build();
    }

    private static ActiveJobResponse toResponse(ScheduledJob job) {
        var p = job.payload();
        ActiveJobResponse.Reminder reminder = p == null ? null
                : new ActiveJobResponse.Reminder(p.fixtureId(), p.offsetMinutes(), p.home(), p.away(), p.league(), p.kickoff());
        return new ActiveJobResponse(job.name(), job.kind().name(), job.nextFireAt(), reminder);
    }
}
