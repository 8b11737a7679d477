package com.flowtrace.engine.analysis;

import com.flowtrace.engine.ast.Location;

public record StateWarning(Kind kind, String message, Location location, int nodeId) {

    public enum Kind {
        TYPE_CHANGE, POSSIBLE_NULL, MODIFIED_IN_LOOP, MODIFIED_IN_CONDITIONAL;

        public String id() {
            return name().toLowerCase();
        }
    }
}
