package com.flowtrace.engine.analysis;

import java.util.List;

/**
 * Version history of one variable inside one scope.
 *
 * @param typeChain the known types in order, consecutive repeats collapsed
 */
public record StateReport(String variable, String scope, List<TypeEvent> events, List<String> typeChain,
                          List<StateWarning> warnings) {}
