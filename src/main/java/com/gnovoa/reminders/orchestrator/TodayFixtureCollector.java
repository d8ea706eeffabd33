package com.gnovoa.reminders.orchestrator;

import com.gnovoa.reminders.model.Fixture;
import com.gnovoa.reminders.model.LeagueDescriptor;
import com.gnovoa.reminders.provider.FetchException;
import com.gnovoa.reminders.provider.FixtureProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches the given day's fixtures for every cached league.
 *
 * <p>Failures are isolated per league: a failed league is logged and counted, the rest are still
 * fetched.
 */
public final class TodayFixtureCollector {

    private static final Logger log = LoggerFactory.getLogger(TodayFixtureCollector.class);

    private final LeagueCache leagues;
    private final FixtureProvider provider;
    private final ZoneId zone;

    public TodayFixtureCollector(LeagueCache leagues, FixtureProvider provider, ZoneId zone) {
        this.leagues = leagues;
        this.provider = provider;
        this.zone = zone;
    }

    /**
     * @param byCountry fixtures kicking off on the requested local date, keyed by every cached
     *     country (possibly with an empty list)
     */
    public record Collected(Map<String, List<Fixture>> byCountry, int leaguesFetched, int leaguesFailed) {}

    public Collected collect(LocalDate day) {
        leagues.ensureLoaded();

        Map<String, List<Fixture>> byCountry = new LinkedHashMap<>();
        int fetched = 0;
        int failed = 0;

        for (var entry : leagues.snapshot().entrySet()) {
            String country = entry.getKey();
            List<Fixture> sameDay = new ArrayList<>();
            byCountry.put(country, sameDay);

            for (LeagueDescriptor league : entry.getValue()) {
                var season = league.latestSeason();
                if (season.isEmpty()) continue;

                List<Fixture> fixtures;
                try {
                    fixtures = provider.fetchFixtures(league.id(), season.get(), day);
                    fetched++;
                } catch (FetchException e) {
                    failed++;
                    log.warn("Fixtures fetch failed ({}, {}): {}", country, league.name(), e.getMessage());
                    continue;
                }

                for (Fixture f : fixtures) {
                    // provider date filter may be off by the zone offset
                    if (f != null && day.equals(f.kickoffDate(zone))) sameDay.add(f);
                }
            }
        }
        return new Collected(byCountry, fetched, failed);
    }
}
