package com.gnovoa.reminders.orchestrator;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record TodayDigest(LocalDate date, List<CountrySection> countries) {

    public record CountrySection(String country, List<Line> fixtures) {}

    public record Line(long fixtureId, LocalTime kickoff, String home, String away, String league) {}

    public int total() {
        return countries.stream().mapToInt(c -> c.fixtures().size()).sum();
    }
}
