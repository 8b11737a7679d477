package com.flowtrace.engine.source;

import java.util.List;

/**
 * Directories to scan under a scope: the project's declared source roots, or the scope itself.
 */
public record SourceRoots(
    String projectRoot,       // absolute path of the scanned scope
    List<String> sourceRoots  // absolute directories to walk, in order
) {}
