package com.xingest.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xingest.core.util.Fixtures;
import com.xingest.core.util.ScrapeJson;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ScrapeResultJsonTest {

    private final ObjectMapper om = ScrapeJson.mapper();

    @Test
    void result_survives_json_round_trip() throws Exception {
        ScrapeResult original = Fixtures.sampleResult("nasa", Instant.parse("2026-03-10T12:00:00Z"));
        String json = om.writeValueAsString(original);
        assertThat(om.readValue(json, ScrapeResult.class)).isEqualTo(original);
    }

    @Test
    void dates_are_iso_strings() throws Exception {
        ScrapeResult r = Fixtures.sampleResult("nasa", Instant.parse("2026-03-10T12:00:00Z"));
        JsonNode tree = om.readTree(om.writeValueAsString(r));
        assertThat(tree.get("scrapedAt").asText()).isEqualTo("2026-03-10T12:00:00Z");
        assertThat(tree.at("/profile/joinedDate").asText()).isEqualTo("2015-06");
        assertThat(tree.at("/posts/0/pinned").asBoolean()).isTrue();
        assertThat(tree.at("/posts/1/replyToUsername").asText()).isEqualTo("someone");
    }

    @Test
    void unknown_properties_are_ignored() throws Exception {
        String json = "{\"success\":false,\"username\":\"ghost\",\"errorMessage\":\"Profile not found\","
                + "\"fetchFailure\":\"NOT_FOUND\",\"somethingNew\":42,\"scrapedAt\":\"2026-01-01T00:00:00Z\"}";
        ScrapeResult r = om.readValue(json, ScrapeResult.class);
        assertThat(r.isSuccess()).isFalse();
        assertThat(r.getFetchFailure()).isEqualTo(FetchFailure.NOT_FOUND);
        assertThat(r.getPosts()).isEmpty();
        assertThat(r.getProfile()).isNull();
    }
}
