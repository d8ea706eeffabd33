package com.gnovoa.reminders.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.reminders.model.Fixture;
import com.gnovoa.reminders.model.LeagueDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link FixtureProvider} backed by the API-Football v3 REST API.
 *
 * <p>The {@link RestTemplate} is expected to carry connect and read timeouts; any transport,
 * HTTP or parsing failure is reported as {@link FetchException}.
 */
public final class ApiFootballClient implements FixtureProvider {

    private static final Logger log = LoggerFactory.getLogger(ApiFootballClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final ZoneId zone;

    public ApiFootballClient(RestTemplate restTemplate, ObjectMapper mapper, String baseUrl, String apiKey, ZoneId zone) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.zone = zone;
    }

    @Override
    public List<LeagueDescriptor> fetchCurrentLeagues(String country) {
        JsonNode response = get("/leagues", Map.of("country", country, "current", "true"));

        List<LeagueDescriptor> leagues = new ArrayList<>();
        for (JsonNode item : response) {
            JsonNode league = item.path("league");
            if (!league.hasNonNull("id")) continue;

            List<Integer> seasons = new ArrayList<>();
            for (JsonNode s : item.path("seasons")) {
                if (s.hasNonNull("year")) seasons.add(s.get("year").asInt());
            }
            leagues.add(new LeagueDescriptor(
                    league.get("id").asLong(),
                    league.path("name").asText(""),
                    item.path("country").path("name").asText(country),
                    seasons));
        }
        log.debug("Fetched {} current leagues for {}", leagues.size(), country);
        return leagues;
    }

    @Override
    public List<Fixture> fetchFixtures(long leagueId, int season, LocalDate date) {
        JsonNode response = get("/fixtures", Map.of(
                "date", date.toString(),
                "league", String.valueOf(leagueId),
                "season", String.valueOf(season),
                "timezone", zone.getId()));

        List<Fixture> fixtures = new ArrayList<>();
        for (JsonNode item : response) fixtures.add(toFixture(item));
        log.debug("Fetched {} fixtures for league {} season {} on {}", fixtures.size(), leagueId, season, date);
        return fixtures;
    }

    // Lenient: missing fields become nulls and are rejected downstream.
    static Fixture toFixture(JsonNode item) {
        JsonNode fx = item.path("fixture");
        JsonNode teams = item.path("teams");
        return new Fixture(
                fx.hasNonNull("id") ? fx.get("id").asLong() : null,
                parseKickoff(fx.path("date").asText(null)),
                teams.path("home").path("name").asText(null),
                teams.path("away").path("name").asText(null),
                item.path("league").path("name").asText(null));
    }

    static Instant parseKickoff(String iso) {
        if (iso == null || iso.isBlank()) return null;
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private JsonNode get(String path, Map<String, String> params) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(baseUrl).path(path);
        params.forEach((name, value) -> uri.queryParam(name, value));
        URI target = uri.encode().build().toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set("x-apisports-key", apiKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<String> entity =
                    restTemplate.exchange(target, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            String body = entity.getBody();
            if (body == null || body.isBlank()) {
                throw new FetchException("Empty response from " + path + " " + params);
            }
            JsonNode root = mapper.readTree(body);
            JsonNode errors = root.path("errors");
            if (errors.isObject() && !errors.isEmpty()) {
                throw new FetchException("Provider errors on " + path + ": " + errors);
            }
            return root.path("response");
        } catch (RestClientException e) {
            throw new FetchException("Request to " + path + " " + params + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new FetchException("Unreadable response from " + path, e);
        }
    }
}
