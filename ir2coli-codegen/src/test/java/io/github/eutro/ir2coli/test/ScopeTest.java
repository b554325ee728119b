package io.github.eutro.ir2coli.test;

import io.github.eutro.ir2coli.codegen.Scope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeTest {
    @Test
    void testShadowing() {
        Scope<Integer> scope = new Scope<>();
        scope.push("x", 1);
        scope.push("x", 2);
        assertEquals(2, scope.get("x"));
        scope.pop("x");
        assertEquals(1, scope.get("x"));
        scope.pop("x");
        assertFalse(scope.contains("x"));
        assertTrue(scope.isEmpty());
    }

    @Test
    void testUnbound() {
        Scope<Integer> scope = new Scope<>();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> scope.get("y"));
        assertTrue(e.getMessage().contains("'y'"));
        assertThrows(IllegalStateException.class, () -> scope.pop("y"));
    }

    @Test
    void testBindingsAreInnermost() {
        Scope<Integer> scope = new Scope<>();
        scope.push("a", 1);
        scope.push("b", 2);
        scope.push("a", 3);
        Map<String, Integer> bindings = scope.bindings();
        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(bindings.keySet()));
        assertEquals(3, bindings.get("a"));

        // the returned map is a copy
        bindings.remove("a");
        assertTrue(scope.contains("a"));
    }
}
