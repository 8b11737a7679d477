package com.flowtrace.engine.query;

import com.flowtrace.engine.ast.Location;

import java.util.List;

/**
 * One line of the show-all listing.
 *
 * @param dependsOn  names read by any version of the variable, sorted
 * @param dependents names written from any version of the variable, sorted
 */
public record VariableSummary(String name, List<Location> definitions, List<String> dependsOn,
                              List<String> dependents) {}
