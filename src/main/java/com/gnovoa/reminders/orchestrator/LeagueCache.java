package com.gnovoa.reminders.orchestrator;

import com.gnovoa.reminders.model.LeagueDescriptor;
import com.gnovoa.reminders.provider.FetchException;
import com.gnovoa.reminders.provider.FixtureProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current leagues per tracked country, fetched once and kept until {@link #invalidate()}.
 *
 * <p>A country whose fetch fails stays uncached and is retried by the next {@link #ensureLoaded()}.
 */
public final class LeagueCache {

    private static final Logger log = LoggerFactory.getLogger(LeagueCache.class);

    private final FixtureProvider provider;
    private final List<String> countries;
    private final Map<String, List<LeagueDescriptor>> byCountry = new ConcurrentHashMap<>();

    public LeagueCache(FixtureProvider provider, List<String> countries) {
        this.provider = provider;
        this.countries = List.copyOf(countries);
    }

    public void ensureLoaded() {
        for (String country : countries) {
            if (byCountry.containsKey(country)) continue;
            try {
                List<LeagueDescriptor> leagues = List.copyOf(provider.fetchCurrentLeagues(country));
                if (byCountry.putIfAbsent(country, leagues) == null) {
                    log.info("Cached {} leagues for {}", leagues.size(), country);
                }
            } catch (FetchException e) {
                log.warn("Failed to cache leagues for {}: {}", country, e.getMessage());
            }
        }
    }

    /** Cached countries in configured order. */
    public Map<String, List<LeagueDescriptor>> snapshot() {
        Map<String, List<LeagueDescriptor>> out = new LinkedHashMap<>();
        for (String country : countries) {
            List<LeagueDescriptor> leagues = byCountry.get(country);
            if (leagues != null) out.put(country, leagues);
        }
        return out;
    }

    public void invalidate() {
        byCountry.clear();
        log.info("League cache cleared");
    }
}
