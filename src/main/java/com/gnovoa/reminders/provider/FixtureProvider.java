package com.gnovoa.reminders.provider;

import com.gnovoa.reminders.model.Fixture;
import com.gnovoa.reminders.model.LeagueDescriptor;

import java.time.LocalDate;
import java.util.List;

/** Source of league and fixture data. Every call may fail independently with {@link FetchException}. */
public interface FixtureProvider {

    List<LeagueDescriptor> fetchCurrentLeagues(String country);

    List<Fixture> fetchFixtures(long leagueId, int season, LocalDate date);
}
