package com.bayesenum.server.ai.network;

import com.bayesenum.server.ai.CptLookupException;
import com.bayesenum.server.ai.UnknownVariableException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BayesianNetworkTest {

    private final BayesianNetwork alarm = TestNetworks.alarm().validate();

    @Test
    void exposesStructure() {
        assertEquals(List.of("Burglary", "Earthquake"), alarm.roots());
        assertEquals(List.of("JohnCalls", "MaryCalls"), alarm.children("Alarm"));
        assertEquals(List.of(), alarm.children("MaryCalls"));
        assertEquals(List.of("Burglary", "Earthquake", "Alarm", "JohnCalls", "MaryCalls"),
                alarm.topologicalOrder());
        assertTrue(alarm.hasNode("Alarm"));
        assertFalse(alarm.hasNode("Cat"));
    }

    @Test
    void unknownNodeFails() {
        assertThrows(UnknownVariableException.class, () -> alarm.getNode("Cat"));
        assertThrows(UnknownVariableException.class, () -> alarm.children("Cat"));
    }

    @Test
    void nodeProbabilityLooksUpByParentTuple() {
        Node node = alarm.getNode("Alarm");
        assertEquals(0.29, node.probability("true", Map.of("Burglary", "false", "Earthquake", "true")), 1e-12);
        assertEquals(0.06, node.probability("false", Map.of("Earthquake", "false", "Burglary", "true")), 1e-12);
        assertEquals(0.001, alarm.getNode("Burglary").probability("true", Map.of()), 1e-12);
    }

    @Test
    void nodeProbabilityFailsOnMissingEntries() {
        Node node = alarm.getNode("Alarm");

        CptLookupException badParent = assertThrows(CptLookupException.class,
                () -> node.probability("true", Map.of("Burglary", "maybe", "Earthquake", "true")));
        assertEquals(List.of("maybe", "true"), badParent.getParentValues());

        CptLookupException badValue = assertThrows(CptLookupException.class,
                () -> node.probability("ringing", Map.of("Burglary", "true", "Earthquake", "true")));
        assertEquals("ringing", badValue.getValue());

        assertThrows(CptLookupException.class, () -> node.probability("true", Map.of("Burglary", "true")));
    }
}
