package com.gnovoa.reminders.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.reminders.config.ProviderProperties;
import com.gnovoa.reminders.config.ReminderProperties;
import com.gnovoa.reminders.config.TelegramProperties;
import com.gnovoa.reminders.dispatch.BroadcastDispatcher;
import com.gnovoa.reminders.dispatch.MessageTransport;
import com.gnovoa.reminders.dispatch.ReminderDelivery;
import com.gnovoa.reminders.dispatch.ReminderMessageFormatter;
import com.gnovoa.reminders.dispatch.SubscriptionRegistry;
import com.gnovoa.reminders.dispatch.TelegramTransport;
import com.gnovoa.reminders.jobs.JobScheduler;
import com.gnovoa.reminders.planner.DedupLedger;
import com.gnovoa.reminders.planner.InMemoryDedupLedger;
import com.gnovoa.reminders.planner.ReminderPlanner;
import com.gnovoa.reminders.provider.ApiFootballClient;
import com.gnovoa.reminders.provider.FixtureProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ReminderWiring {

    private static final int DELIVERY_THREADS = 4;

    @Bean
    public Clock referenceClock(ReminderProperties props) {
        return Clock.system(props.zone());
    }

    @Bean
    public FixtureProvider fixtureProvider(RestTemplateBuilder builder, ObjectMapper mapper, ProviderProperties provider, ReminderProperties props) {
        var rest = builder.connectTimeout(provider.timeout()).readTimeout(provider.timeout()).build();
        return new ApiFootballClient(rest, mapper, provider.baseUrl(), provider.apiKey(), props.zone());
    }

    @Bean
    public MessageTransport messageTransport(RestTemplateBuilder builder, TelegramProperties telegram) {
        var rest = builder.connectTimeout(telegram.timeout()).readTimeout(telegram.timeout()).build();
        return new TelegramTransport(rest, telegram.baseUrl(), telegram.botToken());
    }

    @Bean
    public SubscriptionRegistry subscriptionRegistry() {
        return new SubscriptionRegistry();
    }

    @Bean
    public DedupLedger dedupLedger() {
        return new InMemoryDedupLedger();
    }

    @Bean
    public ReminderPlanner reminderPlanner() {
        return new ReminderPlanner();
    }

    @Bean
    public ReminderMessageFormatter reminderMessageFormatter(ReminderProperties props) {
        return new ReminderMessageFormatter(props.zone());
    }

    @Bean
    public BroadcastDispatcher broadcastDispatcher(MessageTransport transport) {
        return new BroadcastDispatcher(transport);
    }

    @Bean(destroyMethod = "close")
    public JobScheduler jobScheduler(SubscriptionRegistry subscriptions, BroadcastDispatcher dispatcher, ReminderMessageFormatter formatter, Clock clock) {
        return new JobScheduler(new ReminderDelivery(subscriptions, dispatcher, formatter), clock, DELIVERY_THREADS);
    }

    @Bean
    public LeagueCache leagueCache(FixtureProvider provider, ReminderProperties props) {
        return new LeagueCache(provider, props.countries());
    }

    @Bean
    public TodayFixtureCollector todayFixtureCollector(LeagueCache cache, FixtureProvider provider, ReminderProperties props) {
        return new TodayFixtureCollector(cache, provider, props.zone());
    }

    @Bean
    public PullOrchestrator pullOrchestrator(
            TodayFixtureCollector collector,
            ReminderPlanner planner,
            DedupLedger ledger,
            JobScheduler scheduler,
            SubscriptionRegistry subscriptions,
            BroadcastDispatcher dispatcher,
            ReminderMessageFormatter formatter,
            Clock clock,
            ReminderProperties props) {
        return new PullOrchestrator(collector, planner, ledger, scheduler, subscriptions, dispatcher, formatter,
                clock, props.offsets(), props.dailyPullLocalTime());
    }

    @Bean
    public TodayDigestService todayDigestService(TodayFixtureCollector collector, Clock clock) {
        return new TodayDigestService(collector, clock);
    }
}
