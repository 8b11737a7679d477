package com.flowtrace.engine.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deserialized engine configuration. Every key is optional; getters fall back to the built-in defaults.
 */
public class EngineConfig {

    private static final Map<String, List<String>> DEFAULT_SIDE_EFFECT_CALLS = defaultSideEffectCalls();

    private static final List<String> DEFAULT_MUTATING_METHODS = List.of(
        "append", "extend", "insert", "add", "addAll", "update", "put", "putAll", "push", "offer",
        "setdefault", "remove", "discard", "clear", "pop", "popleft", "appendleft");

    /**
     * Call names with an externally observable effect, grouped by category. A value flowing into
     * an argument of one of these calls is a side-effect exit point.
     */
    @SerializedName("side_effect_calls")
    private Map<String, List<String>> sideEffectCalls;

    /** Methods that change their receiver in place, e.g. {@code items.append(x)}. */
    @SerializedName("mutating_methods")
    private List<String> mutatingMethods;

    @SerializedName("risk_medium_exit_points")
    private Integer riskMediumExitPoints;

    @SerializedName("risk_high_exit_points")
    private Integer riskHighExitPoints;

    /** Touching more distinct functions than this is high risk (default: 3). */
    @SerializedName("risk_high_function_count")
    private Integer riskHighFunctionCount;

    /** Default traversal depth; -1 is unbounded. */
    @SerializedName("max_depth")
    private Integer maxDepth;

    /** Default inter-procedural expansion depth; -1 is unbounded. */
    @SerializedName("max_call_depth")
    private Integer maxCallDepth;

    @SerializedName("timeout_seconds")
    private Integer timeoutSeconds;

    @SerializedName("parse_workers")
    private Integer parseWorkers;

    public Map<String, List<String>> getSideEffectCalls() {
        return sideEffectCalls != null ? Collections.unmodifiableMap(sideEffectCalls) : DEFAULT_SIDE_EFFECT_CALLS;
    }

    public List<String> getMutatingMethods() {
        return mutatingMethods != null ? mutatingMethods : DEFAULT_MUTATING_METHODS;
    }

    public int getRiskMediumExitPoints()  { return riskMediumExitPoints  != null ? riskMediumExitPoints  : 3; }
    public int getRiskHighExitPoints()    { return riskHighExitPoints    != null ? riskHighExitPoints    : 8; }
    public int getRiskHighFunctionCount() { return riskHighFunctionCount != null ? riskHighFunctionCount : 3; }
    public int getMaxDepth()              { return maxDepth              != null ? maxDepth              : -1; }
    public int getMaxCallDepth()          { return maxCallDepth          != null ? maxCallDepth          : -1; }
    public int getTimeoutSeconds()        { return timeoutSeconds        != null ? timeoutSeconds        : 60; }
    public int getParseWorkers()          { return parseWorkers          != null ? Math.max(1, parseWorkers) : 4; }

    /** First category (in configuration order) listing {@code callName}. */
    public Optional<String> sideEffectCategory(String callName) {
        if (callName == null) return Optional.empty();
        for (Map.Entry<String, List<String>> e : getSideEffectCalls().entrySet()) {
            if (e.getValue().contains(callName)) return Optional.of(e.getKey());
        }
        return Optional.empty();
    }

    public boolean isMutatingMethod(String callName) {
        return callName != null && getMutatingMethods().contains(callName);
    }

    private static Map<String, List<String>> defaultSideEffectCalls() {
        Map<String, List<String>> calls = new LinkedHashMap<>();
        calls.put("console", List.of("print", "println", "printf", "pprint"));
        calls.put("logging", List.of("debug", "info", "warning", "warn", "error", "exception", "critical",
            "fatal", "trace", "log"));
        calls.put("file", List.of("write", "writelines", "dump", "save", "store", "writeBytes", "writeChars",
            "writeString"));
        calls.put("network", List.of("send", "sendall", "post", "request", "urlopen", "connect", "openConnection"));
        calls.put("database", List.of("execute", "executemany", "executeQuery", "executeUpdate", "commit",
            "rollback", "persist"));
        return Collections.unmodifiableMap(calls);
    }
}
