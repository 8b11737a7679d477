package com.flowtrace.engine.graph;

/**
 * Best-effort static type of one variable version. {@link Unknown} is an explicit value rather
 * than null so every consumer has to decide what an unknown type means for it.
 */
public sealed interface InferredType permits InferredType.Known, InferredType.Unknown {

    InferredType UNKNOWN = new Unknown();

    String display();

    boolean nullable();

    default boolean isKnown() {
        return this instanceof Known;
    }

    /** {@code nullable} is set when the value may be null/None at this version. */
    record Known(String name, boolean nullable) implements InferredType {
        @Override
        public String display() {
            return name;
        }
    }

    record Unknown() implements InferredType {
        @Override
        public String display() {
            return "Unknown";
        }

        @Override
        public boolean nullable() {
            return false;
        }
    }
}
