package com.chicu.causalimpact.smoke;

import com.chicu.causalimpact.support.SyntheticSeries;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ImpactApiSmokeTest {

    @LocalServerPort
    int port;

    private final TestRestTemplate rest = new TestRestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + "/api/impact" + path;
    }

    private static Map<String, Object> body(List<Map<String, Object>> rows, int pauseWeek) {
        Map<String, Object> b = new HashMap<>();
        b.put("series_id", "smoke");
        b.put("rows", rows);
        b.put("intervention_timestamp", SyntheticSeries.week(pauseWeek).toString());
        b.put("config", Map.of("num_draws", 200, "seed", 5));
        return b;
    }

    private static List<Map<String, Object>> stepRows(String... groups) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String g : groups) {
            rows.addAll(SyntheticSeries.rows(SyntheticSeries.step(30, 20, 100.0, 150.0), g));
        }
        return rows;
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyzeReturnsRowsAndSummary() {
        ResponseEntity<Map> resp = rest.postForEntity(url("/analyze"), body(stepRows("M1"), 20), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        Map<String, Object> json = resp.getBody();
        assertNotNull(json);
        assertEquals("M1", json.get("group_key"));
        assertEquals(30, ((List<?>) json.get("rows")).size());

        Map<String, Object> summary = (Map<String, Object>) json.get("summary");
        assertEquals(50.0, ((Number) summary.get("average_effect")).doubleValue(), 0.5);
        assertEquals(Boolean.TRUE, summary.get("significant"));

        Map<String, Map<String, Object>> table = (Map<String, Map<String, Object>>) json.get("summary_table");
        assertEquals(150.0, ((Number) table.get("actual").get("average")).doubleValue(), 1e-9);
        assertEquals(1500.0, ((Number) table.get("actual").get("cumulative")).doubleValue(), 1e-9);
    }

    @Test
    void tooShortPrePeriodIsUnprocessable() {
        ResponseEntity<Map> resp = rest.postForEntity(url("/analyze"), body(stepRows("M1"), 1), Map.class);

        assertEquals(422, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("INSUFFICIENT_DATA", resp.getBody().get("error_code"));
    }

    @Test
    void missingRowsAreBadRequest() {
        Map<String, Object> b = body(List.of(), 20);

        ResponseEntity<Map> resp = rest.postForEntity(url("/analyze"), b, Map.class);

        assertEquals(400, resp.getStatusCode().value());
    }

    @Test
    void severalGroupsNeedAGroupKey() {
        ResponseEntity<Map> resp = rest.postForEntity(url("/analyze"), body(stepRows("A", "B"), 20), Map.class);
        assertEquals(400, resp.getStatusCode().value());

        ResponseEntity<Map> groups = rest.postForEntity(url("/groups"), body(stepRows("A", "B"), 20), Map.class);
        assertEquals(200, groups.getStatusCode().value());
        assertEquals(List.of("A", "B"), groups.getBody().get("groups"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyzeGroupsReportsEveryGroup() {
        Map<String, Object> b = body(stepRows("A", "B"), 20);
        b.put("series_id", "smoke-groups");

        ResponseEntity<Map> resp = rest.postForEntity(url("/analyze-groups"), b, Map.class);

        assertEquals(200, resp.getStatusCode().value());
        List<Map<String, Object>> outcomes = (List<Map<String, Object>>) resp.getBody().get("groups");
        assertEquals(2, outcomes.size());
        assertEquals("A", outcomes.get(0).get("group_key"));
        assertEquals(Boolean.TRUE, outcomes.get(0).get("ok"));

        ResponseEntity<Map> del = rest.exchange(url("/cache/smoke-groups"), HttpMethod.DELETE, null, Map.class);
        assertEquals(200, del.getStatusCode().value());
        assertEquals(2, del.getBody().get("removed"));
    }
}
