package io.calrecur.eval;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.calrecur.ast.RecurrenceRule;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Expansion vectors loaded from recurrence-vectors.json. */
public class RecurrenceConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode VECTORS;

  @BeforeAll
  static void loadVectors() throws IOException {
    try (InputStream in =
        RecurrenceConformanceTest.class.getResourceAsStream("/recurrence-vectors.json")) {
      assertNotNull(in, "recurrence-vectors.json not on the test classpath");
      VECTORS = MAPPER.readTree(in);
    }
  }

  @TestFactory
  Stream<DynamicTest> expandTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : VECTORS.get("expand")) {
      String name = tc.get("name").asText();
      String rule = tc.get("rule").asText();
      LocalDateTime dtstart = LocalDateTime.parse(tc.get("dtstart").asText());
      List<LocalDateTime> expected = new ArrayList<>();
      for (JsonNode e : tc.get("expected")) {
        expected.add(LocalDateTime.parse(e.asText()));
      }
      long take = tc.has("take") ? tc.get("take").asLong() : Long.MAX_VALUE;

      tests.add(
          DynamicTest.dynamicTest(
              name + " [" + rule + "]",
              () -> {
                RecurrenceRule parsed = RecurrenceRule.parse(rule);
                List<LocalDateTime> actual =
                    RecurrenceEvaluator.expand(parsed, dtstart).limit(take).toList();
                assertEquals(expected, actual, rule);
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> invariantTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : VECTORS.get("expand")) {
      String rule = tc.get("rule").asText();
      LocalDateTime dtstart = LocalDateTime.parse(tc.get("dtstart").asText());

      tests.add(
          DynamicTest.dynamicTest(
              "ascending and not before start [" + rule + "]",
              () -> {
                RecurrenceRule parsed = RecurrenceRule.parse(rule);
                List<LocalDateTime> actual =
                    RecurrenceEvaluator.expand(parsed, dtstart).limit(50).toList();
                LocalDateTime previous = null;
                for (LocalDateTime t : actual) {
                  assertFalse(t.isBefore(dtstart), t + " before " + dtstart);
                  if (previous != null) {
                    assertTrue(t.isAfter(previous), t + " not after " + previous);
                  }
                  previous = t;
                }
                if (parsed.count() > 0) {
                  assertEquals(parsed.count(), actual.size());
                }
              }));
    }
    return tests.stream();
  }
}
