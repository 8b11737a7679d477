package com.flowtrace.engine.analysis;

import com.flowtrace.engine.ast.Location;

/**
 * A place where a traced value leaves local computation.
 *
 * @param subType  {@code return}, {@code field}, {@code global}, or the side-effect category
 * @param function function the exit occurs in, {@code <module>} at top level
 */
public record ExitPoint(ExitCategory category, String subType, String function, Location location,
                        String description, int nodeId) {}
