package com.gnovoa.reminders.orchestrator;

import com.gnovoa.reminders.config.ReminderProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public final class PullBootstrap {

    private final ReminderProperties props;
    private final PullOrchestrator orchestrator;

    public PullBootstrap(ReminderProperties props, PullOrchestrator orchestrator) {
        this.props = props;
        this.orchestrator = orchestrator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        // safety net for deploys after the daily pull time
        if (props.bootPullEnabled()) orchestrator.scheduleBootPull(props.bootPullDelay());
        if (props.dailyPullOnBoot()) orchestrator.enableDaily();
    }
}
