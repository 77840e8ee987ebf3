package io.monkeylang.eval;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest {

    @Test void missIsEmpty() { assertTrue(new Environment().get("x").isEmpty()); }

    @Test void setThenGet() {
        Environment env = new Environment();
        Value five = new Value.IntegerValue(5);
        assertSame(five, env.set("x", five));
        assertSame(five, env.get("x").orElseThrow());
    }

    @Test void setOverwrites() {
        Environment env = new Environment();
        env.set("x", Value.TRUE);
        env.set("x", Value.FALSE);
        assertSame(Value.FALSE, env.get("x").orElseThrow());
    }

    @Test void enclosedScopeReadsOuter() {
        Environment outer = new Environment();
        outer.set("x", Value.TRUE);
        Environment inner = new Environment(outer);
        assertSame(Value.TRUE, inner.get("x").orElseThrow());
    }

    @Test void enclosedScopeShadowsWithoutTouchingOuter() {
        Environment outer = new Environment();
        outer.set("x", Value.TRUE);
        Environment inner = new Environment(outer);
        inner.set("x", Value.FALSE);
        inner.set("y", Value.NULL);
        assertSame(Value.FALSE, inner.get("x").orElseThrow());
        assertSame(Value.TRUE, outer.get("x").orElseThrow());
        assertTrue(outer.get("y").isEmpty());
    }

    @Test void noValueBinding() {
        Environment env = new Environment();
        assertNull(env.set("x", null));
        assertTrue(env.has("x"));
        assertTrue(env.get("x").isEmpty());
        assertFalse(env.has("y"));
    }

    @Test void noValueBindingShadowsOuter() {
        Environment outer = new Environment();
        outer.set("x", Value.TRUE);
        Environment inner = new Environment(outer);
        inner.set("x", null);
        assertTrue(inner.has("x"));
        assertTrue(inner.get("x").isEmpty());
        assertTrue(outer.has("x"));
    }

    @Test void nullsRejected() {
        Environment env = new Environment();
        assertThrows(NullPointerException.class, () -> env.set(null, Value.TRUE));
        assertThrows(NullPointerException.class, () -> new Environment(null));
    }
}
