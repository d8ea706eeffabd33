package com.gnovoa.reminders.model;

import java.util.List;
import java.util.Optional;

public record LeagueDescriptor(long id, String name, String country, List<Integer> seasons) {

    public LeagueDescriptor {
        seasons = seasons == null ? List.of() : List.copyOf(seasons);
    }

    public Optional<Integer> latestSeason() {
        return seasons.stream().max(Integer::compare);
    }
}
