package io.monkeylang.eval;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test void typeTags() {
        assertEquals(Value.Type.INTEGER, new Value.IntegerValue(1).type());
        assertEquals(Value.Type.BOOLEAN, Value.TRUE.type());
        assertEquals(Value.Type.NULL, Value.NULL.type());
        assertEquals(Value.Type.RETURN_VALUE, new Value.ReturnValue(Value.NULL).type());
        assertEquals(Value.Type.ERROR, new Value.ErrorValue("boom").type());
    }

    @Test void boolMapsToSingletons() {
        assertSame(Value.TRUE, Value.bool(true));
        assertSame(Value.FALSE, Value.bool(false));
        assertTrue(Value.TRUE.value());
        assertFalse(Value.FALSE.value());
    }

    @Test void errorFormatsMessage() {
        assertEquals("unknown operator: -BOOLEAN", Value.error("unknown operator: -%s", Value.Type.BOOLEAN).message());
    }

    @Test void onlyErrorsAreErrors() {
        assertTrue(new Value.ErrorValue("x").isError());
        assertFalse(Value.NULL.isError());
        assertFalse(new Value.ReturnValue(new Value.ErrorValue("x")).isError());
    }

    @Test void truthiness() {
        assertFalse(Evaluator.isTruthy(Value.NULL));
        assertFalse(Evaluator.isTruthy(Value.FALSE));
        assertTrue(Evaluator.isTruthy(Value.TRUE));
        assertTrue(Evaluator.isTruthy(new Value.IntegerValue(0)));
    }
}
