package com.clinicalguard.rules.expression;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.clinicalguard.rules.FactContext;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Unit tests for ExpressionParser
 *
 * Parses rule logic and evaluates the resulting tree against fact contexts.
 */
@DisplayName("ExpressionParser Tests")
class ExpressionParserTest {

    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ExpressionParser(new ObjectMapper());
    }

    private Object eval(String logic, Map<String, ?> facts) {
        return parser.parse(logic).evaluate(FactContext.of(facts));
    }

    @Nested
    @DisplayName("Comparisons")
    class ComparisonTests {

        @Test
        @DisplayName("Should compare numbers across integer and decimal representations")
        void shouldCompareNumbers() {
            assertEquals(Boolean.TRUE, eval("{\">\":[{\"var\":\"riskScore\"},80]}", Map.of("riskScore", 85)));
            assertEquals(Boolean.FALSE, eval("{\">\":[{\"var\":\"riskScore\"},80]}", Map.of("riskScore", 80.0)));
            assertEquals(Boolean.TRUE, eval("{\">=\":[{\"var\":\"riskScore\"},80]}", Map.of("riskScore", 80L)));
            assertEquals(Boolean.TRUE, eval("{\"<=\":[{\"var\":\"x\"},1.5]}", Map.of("x", 1.25)));
        }

        @Test
        @DisplayName("Should accept numeric strings")
        void shouldAcceptNumericStrings() {
            assertEquals(Boolean.TRUE, eval("{\"<\":[{\"var\":\"labs.eGFR\"},30]}",
                Map.of("labs", Map.of("eGFR", "25"))));
        }

        @Test
        @DisplayName("Missing facts should make comparisons false")
        void missingFactsShouldBeFalse() {
            assertEquals(Boolean.FALSE, eval("{\">\":[{\"var\":\"riskScore\"},80]}", Map.of()));
            assertEquals(Boolean.FALSE, eval("{\"<\":[{\"var\":\"riskScore\"},80]}", Map.of()));
            assertEquals(Boolean.FALSE, eval("{\"==\":[{\"var\":\"isNewSignup\"},true]}", Map.of()));
        }

        @Test
        @DisplayName("Equality should treat boolean text and booleans alike")
        void equalityShouldBeLoose() {
            assertEquals(Boolean.TRUE, eval("{\"==\":[{\"var\":\"isNewSignup\"},true]}", Map.of("isNewSignup", true)));
            assertEquals(Boolean.TRUE, eval("{\"==\":[{\"var\":\"isNewSignup\"},true]}", Map.of("isNewSignup", "TRUE")));
            assertEquals(Boolean.TRUE, eval("{\"==\":[{\"var\":\"n\"},2]}", Map.of("n", "2.0")));
        }
    }

    @Nested
    @DisplayName("Logic and membership")
    class LogicTests {

        @Test
        @DisplayName("or should fire on either branch")
        void orShouldFireOnEitherBranch() {
            String logic = "{\"if\":[{\"or\":[{\">\":[{\"var\":\"vitals.systolicBp\"},180]},"
                + "{\"<\":[{\"var\":\"vitals.oxygenSaturation\"},92]}]},\"ALERT\",\"CONTINUE\"]}";

            assertEquals("ALERT", eval(logic, Map.of("vitals", Map.of("systolicBp", 190))));
            assertEquals("ALERT", eval(logic, Map.of("vitals", Map.of("oxygenSaturation", 88))));
            assertEquals("CONTINUE", eval(logic, Map.of("vitals", Map.of("systolicBp", 120, "oxygenSaturation", 98))));
        }

        @Test
        @DisplayName("and should require every branch")
        void andShouldRequireEveryBranch() {
            String logic = "{\"if\":[{\"and\":[{\"var\":\"a\"},{\"var\":\"b\"}]},\"BOTH\",\"CONTINUE\"]}";

            assertEquals("BOTH", eval(logic, Map.of("a", true, "b", 1)));
            assertEquals("CONTINUE", eval(logic, Map.of("a", true, "b", 0)));
        }

        @Test
        @DisplayName("in should test list membership and substrings")
        void inShouldTestMembership() {
            String listLogic = "{\"if\":[{\"in\":[{\"var\":\"medicationClass\"},[\"opioid\",\"benzodiazepine\"]]},\"HIT\",\"CONTINUE\"]}";
            String textLogic = "{\"if\":[{\"in\":[\"warfarin\",{\"var\":\"note\"}]},\"HIT\",\"CONTINUE\"]}";

            assertEquals("HIT", eval(listLogic, Map.of("medicationClass", "opioid")));
            assertEquals("CONTINUE", eval(listLogic, Map.of("medicationClass", "statin")));
            assertEquals("CONTINUE", eval(listLogic, Map.of()));
            assertEquals("HIT", eval(textLogic, Map.of("note", "on warfarin 5mg")));
        }

        @Test
        @DisplayName("if without else should be undefined on a miss")
        void ifWithoutElseShouldBeUndefined() {
            assertNull(eval("{\"if\":[{\"var\":\"flag\"},\"YES\"]}", Map.of("flag", false)));
        }

        @Test
        @DisplayName("if should support else-if chains")
        void ifShouldSupportChains() {
            String logic = "{\"if\":[{\">\":[{\"var\":\"x\"},10]},\"BIG\",{\">\":[{\"var\":\"x\"},5]},\"MEDIUM\",\"SMALL\"]}";

            assertEquals("BIG", eval(logic, Map.of("x", 11)));
            assertEquals("MEDIUM", eval(logic, Map.of("x", 6)));
            assertEquals("SMALL", eval(logic, Map.of("x", 1)));
        }

        @Test
        @DisplayName("var should use its default when the fact is absent")
        void varShouldUseDefault() {
            assertEquals(Boolean.TRUE, eval("{\">\":[{\"var\":[\"score\",50]},40]}", Map.of()));
        }

        @Test
        @DisplayName("var should index into lists")
        void varShouldIndexLists() {
            assertEquals("b", eval("{\"var\":\"items.1\"}", Map.of("items", List.of("a", "b"))));
        }
    }

    @Nested
    @DisplayName("Malformed logic")
    class MalformedTests {

        @ParameterizedTest
        @ValueSource(strings = {
            "",
            "{not json",
            "{\"unknownOp\":[1,2]}",
            "{\">\":[1]}",
            "{\">\":[1,2,3]}",
            "{\"in\":[1]}",
            "{\"if\":[true]}",
            "{\"and\":[]}",
            "{\"var\":[]}",
            "{\"var\":\"\"}",
            "{\"var\":[\"a\",1,2]}",
            "{\">\":[1,2],\"<\":[1,2]}"
        })
        @DisplayName("Should reject malformed rule logic")
        void shouldRejectMalformedLogic(String logic) {
            assertThrows(MalformedRuleException.class, () -> parser.parse(logic));
        }

        @Test
        @DisplayName("Should reject null logic")
        void shouldRejectNull() {
            assertThrows(MalformedRuleException.class, () -> parser.parse((String) null));
        }
    }
}
