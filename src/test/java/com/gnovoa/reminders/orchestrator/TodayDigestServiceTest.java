package com.gnovoa.reminders.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.reminders.model.Fixture;
import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class TodayDigestServiceTest {

  private static final ZoneId DUBAI = ZoneId.of("Asia/Dubai");

  private static java.time.Instant at(int hour, int minute) {
    return ZonedDateTime.of(2026, 10, 19, hour, minute, 0, 0, DUBAI).toInstant();
  }

  @Test
  void groupsTodayFixturesByCountryWithoutScheduling() {
    var provider = new FakeFixtureProvider()
        .league("Spain", 140, "La Liga", 2026)
        .league("England", 39, "Premier League", 2026)
        .league("Italy", 135, "Serie A", 2026)
        .fixtures(140,
            new Fixture(2L, at(21, 0), "Sevilla", "Betis", "La Liga"),
            new Fixture(1L, at(18, 0), "Girona", "Getafe", "La Liga"))
        .fixtures(135, new Fixture(3L, at(9, 0), "Roma", "Lazio", "Serie A"));
    provider.failingLeagues.add(39L);

    var cache = new LeagueCache(provider, List.of("Spain", "England", "Italy"));
    var service = new TodayDigestService(
        new TodayFixtureCollector(cache, provider, DUBAI), Clock.fixed(at(12, 0), DUBAI));

    TodayDigest digest = service.digest();

    assertThat(digest.date()).hasToString("2026-10-19");
    assertThat(digest.countries()).extracting(TodayDigest.CountrySection::country)
        .containsExactly("Spain", "Italy");
    assertThat(digest.countries().get(0).fixtures())
        .extracting(TodayDigest.Line::kickoff)
        .containsExactly(LocalTime.of(18, 0), LocalTime.of(21, 0));
    // already-started fixtures are still listed
    assertThat(digest.total()).isEqualTo(3);
  }
}
