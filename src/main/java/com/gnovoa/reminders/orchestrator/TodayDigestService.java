package com.gnovoa.reminders.orchestrator;

import com.gnovoa.reminders.model.Fixture;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Today's fixtures across tracked countries, without scheduling anything. */
public final class TodayDigestService {

    private final TodayFixtureCollector collector;
    private final Clock clock;

    public TodayDigestService(TodayFixtureCollector collector, Clock clock) {
        this.collector = collector;
        this.clock = clock;
    }

    public TodayDigest digest() {
        LocalDate today = LocalDate.now(clock);
        var collected = collector.collect(today);

        List<TodayDigest.CountrySection> sections = new ArrayList<>();
        collected.byCountry().forEach((country, fixtures) -> {
            List<TodayDigest.Line> lines = fixtures.stream()
                    .filter(Fixture::isComplete)
                    .sorted(Comparator.comparing(Fixture::kickoff))
                    .map(f -> new TodayDigest.Line(
                            f.id(),
                            f.kickoff().atZone(clock.getZone()).toLocalTime(),
                            f.home(),
                            f.away(),
                            f.league()))
                    .toList();
            if (!lines.isEmpty()) sections.add(new TodayDigest.CountrySection(country, lines));
        });
        return new TodayDigest(today, sections);
    }
}
