package io.monkeylang.eval;

/**
 * Runtime values produced by the evaluator. Sealed interface with one variant per type tag.
 * <p>
 * Booleans and null are canonical singletons: {@link #TRUE}, {@link #FALSE} and {@link #NULL}
 * are the only instances, so identity comparison is value comparison.
 */
public sealed interface Value
        permits Value.IntegerValue, Value.BooleanValue, Value.NullValue, Value.ReturnValue, Value.ErrorValue {

    /** Type tags. Constant names appear verbatim in error messages. */
    enum Type { INTEGER, BOOLEAN, NULL, RETURN_VALUE, ERROR }

    BooleanValue TRUE = new BooleanValue(true);
    BooleanValue FALSE = new BooleanValue(false);
    NullValue NULL = new NullValue();

    Type type();

    default boolean isError() {
        return type() == Type.ERROR;
    }

    static BooleanValue bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    static ErrorValue error(String format, Object... args) {
        return new ErrorValue(String.format(format, args));
    }

    record IntegerValue(long value) implements Value {
        @Override
        public Type type() { return Type.INTEGER; }
    }

    final class BooleanValue implements Value {
        private final boolean value;

        private BooleanValue(boolean value) {
            this.value = value;
        }

        public boolean value() { return value; }

        @Override
        public Type type() { return Type.BOOLEAN; }

        @Override
        public String toString() { return String.valueOf(value); }
    }

    final class NullValue implements Value {
        private NullValue() {}

        @Override
        public Type type() { return Type.NULL; }

        @Override
        public String toString() { return "null"; }
    }

    /** Carries a return statement's payload up through enclosing blocks. */
    record ReturnValue(Value value) implements Value {
        @Override
        public Type type() { return Type.RETURN_VALUE; }
    }

    record ErrorValue(String message) implements Value {
        @Override
        public Type type() { return Type.ERROR; }
    }
}
