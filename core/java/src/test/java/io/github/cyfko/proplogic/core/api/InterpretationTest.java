package io.github.cyfko.proplogic.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Interpretation Tests")
class InterpretationTest {

    @Test
    @DisplayName("Inline and map forms evaluate identically")
    void testInlineMatchesMap() {
        Formula formula = new Iff(new Implies(new Atomic("p"), new Atomic("q")), new Atomic("r"));

        for (boolean p : new boolean[]{true, false}) {
            for (boolean q : new boolean[]{true, false}) {
                for (boolean r : new boolean[]{true, false}) {
                    boolean inline = formula.interpret(Interpretation.of("p", p, "q", q, "r", r));
                    boolean mapped = formula.interpret(Map.of("p", p, "q", q, "r", r));
                    assertEquals(mapped, inline);
                }
            }
        }
    }

    @Test
    @DisplayName("Lookup returns assigned values and empty for unassigned names")
    void testLookup() {
        Interpretation interpretation = Interpretation.of("p", true, "q", false);

        assertEquals(Optional.of(true), interpretation.lookup("p"));
        assertEquals(Optional.of(false), interpretation.lookup("q"));
        assertEquals(Optional.empty(), interpretation.lookup("r"));
        assertEquals(Optional.empty(), Interpretation.of().lookup("p"));
        assertEquals(Optional.of(true), Interpretation.of("x", true).lookup("x"));
    }

    @Test
    @DisplayName("from() takes a snapshot of the source map")
    void testSnapshot() {
        Map<String, Boolean> source = new HashMap<>();
        source.put("p", true);
        Interpretation interpretation = Interpretation.from(source);

        source.put("p", false);
        source.put("q", true);

        assertEquals(Optional.of(true), interpretation.lookup("p"));
        assertEquals(Optional.empty(), interpretation.lookup("q"));
    }

    @Test
    @DisplayName("Builder keeps the last assignment of a variable")
    void testBuilder() {
        Interpretation interpretation = Interpretation.builder()
                .assign("p", true)
                .assign("p", false)
                .build();

        assertEquals(Optional.of(false), interpretation.lookup("p"));
        assertThrows(NullPointerException.class, () -> Interpretation.builder().assign(null, true));
    }

    @Test
    @DisplayName("Lambda interpretations are accepted")
    void testFunctionalInterpretation() {
        Interpretation allTrue = name -> Optional.of(true);
        assertTrue(new Implies(new Atomic("anything"), new Atomic("else")).interpret(allTrue));
    }

    @Test
    @DisplayName("Null map is rejected")
    void testNullMap() {
        assertThrows(NullPointerException.class, () -> Interpretation.from(null));
    }

    @Test
    @DisplayName("Inline form rejects a repeated variable")
    void testInlineDuplicate() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Interpretation.of("p", true, "p", false));
        assertTrue(e.getMessage().contains("p"));
        assertThrows(IllegalArgumentException.class, () -> Interpretation.of("p", true, "q", true, "q", true));
    }

    @Test
    @DisplayName("Builder snapshots its assignments")
    void testBuilderSnapshot() {
        Interpretation.Builder builder = Interpretation.builder().assign("p", true);
        Interpretation first = builder.build();
        builder.assign("q", false);

        assertEquals(Optional.empty(), first.lookup("q"));
        assertEquals(Optional.of(false), builder.build().lookup("q"));
    }
}
