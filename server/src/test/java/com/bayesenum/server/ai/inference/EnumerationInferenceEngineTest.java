package com.bayesenum.server.ai.inference;

import com.bayesenum.server.ai.CptLookupException;
import com.bayesenum.server.ai.DegenerateEvidenceException;
import com.bayesenum.server.ai.InferenceCancelledException;
import com.bayesenum.server.ai.UnknownVariableException;
import com.bayesenum.server.ai.inference.trace.EnumerationTraceListener;
import com.bayesenum.server.ai.network.BayesianNetwork;
import com.bayesenum.server.ai.network.NetworkBuilder;
import com.bayesenum.server.ai.network.TestNetworks;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnumerationInferenceEngineTest {

    private static final double EPS = 1e-9;

    private final EnumerationInferenceEngine rain = new EnumerationInferenceEngine(
            TestNetworks.rainUmbrella().validate());
    private final EnumerationInferenceEngine alarm = new EnumerationInferenceEngine(TestNetworks.alarm().validate());

    @Test
    void rainGivenUmbrellaFollowsBayesRule() {
        Map<String, Double> posterior = rain.ask("Rain", Map.of("Umbrella", "yes"));

        assertEquals(0.18 / 0.34, posterior.get("yes"), EPS);
        assertEquals(0.16 / 0.34, posterior.get("no"), EPS);
        assertEquals(0.5294, posterior.get("yes"), 1e-4);
        assertEquals(List.of("yes", "no"), List.copyOf(posterior.keySet()));
    }

    @Test
    void rootWithoutEvidenceReturnsItsPrior() {
        Map<String, Double> posterior = rain.ask("Rain", Map.of());
        assertEquals(0.2, posterior.get("yes"), EPS);
        assertEquals(0.8, posterior.get("no"), EPS);
    }

    @Test
    void burglaryGivenBothCalls() {
        InferenceResult result = alarm.infer("Burglary", Map.of("JohnCalls", "true", "MaryCalls", "true"),
                EnumerationTraceListener.NONE);

        assertEquals(0.284171835, result.probability("true"), 1e-8);
        assertEquals(0.715828165, result.probability("false"), 1e-8);
        assertEquals("false", result.getMostLikelyValue());
        assertEquals("enumeration", result.getEngineUsed());
    }

    @Test
    void marginalsOfHiddenDescendants() {
        assertEquals(0.0521389757, alarm.ask("JohnCalls", Map.of()).get("true"), 1e-10);
        assertEquals(0.002516442, alarm.ask("Alarm", Map.of()).get("true"), 1e-10);
        assertEquals(0.231008702, alarm.ask("Earthquake", Map.of("Alarm", "true")).get("true"), 1e-8);
    }

    @Test
    void everyPosteriorSumsToOne() {
        for (String q : alarm.getNetwork().nodeNames()) {
            for (Map<String, String> evidence : List.of(Map.<String, String>of(), Map.of("MaryCalls", "true"),
                    Map.of("Burglary", "false", "JohnCalls", "true"))) {
                Map<String, Double> posterior = alarm.ask(q, evidence);
                assertEquals(1.0, MathUtil.sum(posterior), 1e-6, q + " | " + evidence);
                for (double p : posterior.values()) {
                    assertTrue(p >= 0.0);
                }
            }
        }
    }

    @Test
    void enumerationIsIndependentOfTopologicalOrder() {
        List<String> canonical = alarm.getNetwork().topologicalOrder();
        List<String> alternative = List.of("Earthquake", "Burglary", "Alarm", "MaryCalls", "JohnCalls");

        List<Map<String, String>> assignments = List.of(
                Map.of(),
                Map.of("Alarm", "true"),
                Map.of("Burglary", "true", "MaryCalls", "false"),
                Map.of("Burglary", "true", "Earthquake", "false", "Alarm", "true", "JohnCalls", "true",
                        "MaryCalls", "true"));
        for (Map<String, String> a : assignments) {
            assertEquals(alarm.enumerateAll(canonical, a), alarm.enumerateAll(alternative, a), 1e-12,
                    a.toString());
        }
        assertEquals(1.0, alarm.enumerateAll(canonical, Map.of()), 1e-12);
        assertEquals(0.0005910156, alarm.enumerateAll(canonical, assignments.get(3)), 1e-12);
    }

    @Test
    void evidenceOnTheQueryVariableIsOverridden() {
        Map<String, Double> posterior = rain.ask("Rain", Map.of("Rain", "no", "Umbrella", "yes"));
        assertEquals(0.18 / 0.34, posterior.get("yes"), EPS);
    }

    @Test
    void evidenceOnUnknownVariablesIsIgnored() {
        Map<String, Double> posterior = rain.ask("Rain", Map.of("Umbrella", "yes", "Mood", "grumpy"));
        assertEquals(0.18 / 0.34, posterior.get("yes"), EPS);
    }

    @Test
    void evidenceIsNotMutated() {
        Map<String, String> evidence = new HashMap<>(Map.of("JohnCalls", "true"));
        alarm.ask("Burglary", evidence);
        assertEquals(Map.of("JohnCalls", "true"), evidence);
    }

    @Test
    void unknownQueryVariableFails() {
        UnknownVariableException e = assertThrows(UnknownVariableException.class,
                () -> rain.ask("Snow", Map.of()));
        assertEquals("Snow", e.getVariable());
    }

    @Test
    void outOfDomainEvidenceIsALookupError() {
        CptLookupException e = assertThrows(CptLookupException.class,
                () -> rain.ask("Rain", Map.of("Umbrella", "maybe")));
        assertEquals("Umbrella", e.getNode());

        assertThrows(CptLookupException.class, () -> rain.ask("Umbrella", Map.of("Rain", "sometimes")));
    }

    @Test
    void impossibleEvidenceIsReportedNotNormalized() {
        NetworkBuilder b = new NetworkBuilder();
        b.addEdge("Rain", "WetGrass");
        b.setDomain("Rain", List.of("yes", "no"));
        b.setDomain("WetGrass", List.of("yes", "no"));
        b.setCptRow("Rain", List.of(), Map.of("yes", 0.3, "no", 0.7));
        b.setCptRow("WetGrass", List.of("yes"), Map.of("yes", 1.0, "no", 0.0));
        b.setCptRow("WetGrass", List.of("no"), Map.of("yes", 1.0, "no", 0.0));
        EnumerationInferenceEngine engine = new EnumerationInferenceEngine(b.validate());

        DegenerateEvidenceException e = assertThrows(DegenerateEvidenceException.class,
                () -> engine.ask("Rain", Map.of("WetGrass", "no")));
        assertEquals(Map.of("WetGrass", "no"), e.getEvidence());
    }

    @Test
    void multiValuedHiddenVariable() {
        NetworkBuilder b = new NetworkBuilder();
        b.addEdge("Weather", "Traffic");
        b.addEdge("Traffic", "Late");
        b.setDomain("Weather", List.of("sun", "rain", "snow"));
        b.setDomain("Traffic", List.of("light", "heavy"));
        b.setDomain("Late", List.of("yes", "no"));
        b.setCptRow("Weather", List.of(), Map.of("sun", 0.6, "rain", 0.3, "snow", 0.1));
        b.setCptRow("Traffic", List.of("sun"), Map.of("light", 0.8, "heavy", 0.2));
        b.setCptRow("Traffic", List.of("rain"), Map.of("light", 0.4, "heavy", 0.6));
        b.setCptRow("Traffic", List.of("snow"), Map.of("light", 0.1, "heavy", 0.9));
        b.setCptRow("Late", List.of("light"), Map.of("yes", 0.1, "no", 0.9));
        b.setCptRow("Late", List.of("heavy"), Map.of("yes", 0.7, "no", 0.3));
        EnumerationInferenceEngine engine = new EnumerationInferenceEngine(b.validate());

        // P(heavy) = 0.12 + 0.18 + 0.09 = 0.39
        double lateYes = 0.39 * 0.7 + 0.61 * 0.1;
        assertEquals(lateYes, engine.ask("Late", Map.of()).get("yes"), EPS);

        Map<String, Double> weather = engine.ask("Weather", Map.of("Late", "yes"));
        double sun = 0.6 * (0.8 * 0.1 + 0.2 * 0.7);
        assertEquals(sun / lateYes, weather.get("sun"), EPS);
        assertEquals(List.of("sun", "rain", "snow"), List.copyOf(weather.keySet()));
    }

    @Test
    void interruptedThreadCancelsTheQuery() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(InferenceCancelledException.class, () -> alarm.ask("Burglary", Map.of()));
        } finally {
            Thread.interrupted();
        }
    }
}
