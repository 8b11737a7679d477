package com.flowtrace.engine.source;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects the files a query covers: explicit files plus, optionally, a directory scope.
 * Output is sorted and de-duplicated so that graph construction order is reproducible.
 */
public class SourceCollector {

    public static class SourceCollectionException extends RuntimeException {
        public SourceCollectionException(String msg) { super(msg); }
        public SourceCollectionException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** An explicit file left out of the query, with the reason. */
    public record Skipped(Path path, String reason) {}

    /** The files to analyze plus the explicit files that were left out. */
    public record Selection(List<Path> files, List<Skipped> skipped) {}

    private final SourceRootResolver rootResolver = new SourceRootResolver();

    /**
     * @param files     explicit files; missing ones are reported and skipped
     * @param scope     directory to scan, or null
     * @param recursive walk subdirectories of the scope
     * @param include   glob matched against file names (null: every supported extension)
     * @param exclude   glob matched against the path relative to the scope (null: nothing excluded)
     */
    public List<Path> collect(List<Path> files, Path scope, boolean recursive, String include, String exclude) {
        return select(files, scope, recursive, include, exclude).files();
    }

    /** Like {@link #collect}, but also returns the explicit files that were skipped. */
    public Selection select(List<Path> files, Path scope, boolean recursive, String include, String exclude) {
        Set<Path> result = new LinkedHashSet<>();
        List<Skipped> skipped = new ArrayList<>();
        for (Path f : files) {
            String reason = null;
            if (!Files.isRegularFile(f)) {
                reason = "file not found";
            } else if (Language.fromPath(f).isEmpty()) {
                reason = "unsupported file type";
            }
            if (reason != null) {
                System.err.println("[flowtrace] Warning: " + reason + ", skipped: " + f);
                skipped.add(new Skipped(f, reason));
                continue;
            }
            result.add(f.toAbsolutePath().normalize());
        }
        if (scope != null) {
            if (!Files.isDirectory(scope)) {
                throw new SourceCollectionException("Scope is not a directory: " + scope);
            }
            result.addAll(scan(scope, recursive, include, exclude));
        }
        return new Selection(result.stream().sorted().collect(Collectors.toList()), skipped);
    }

    private List<Path> scan(Path scope, boolean recursive, String include, String exclude) {
        PathMatcher includeMatcher = include == null ? null : FileSystems.getDefault().getPathMatcher("glob:" + include);
        PathMatcher excludeMatcher = exclude == null ? null : FileSystems.getDefault().getPathMatcher("glob:" + exclude);
        Path scopeRoot = scope.toAbsolutePath().normalize();

        List<Path> found = new ArrayList<>();
        for (String root : rootResolver.resolve(scope).sourceRoots()) {
            try (Stream<Path> walk = Files.walk(Path.of(root), recursive ? Integer.MAX_VALUE : 1)) {
                walk.filter(Files::isRegularFile)
                    .filter(p -> Language.fromPath(p).isPresent())
                    .filter(p -> includeMatcher == null || includeMatcher.matches(p.getFileName()))
                    .filter(p -> excludeMatcher == null || !excludeMatcher.matches(scopeRoot.relativize(p.toAbsolutePath().normalize())))
                    .map(p -> p.toAbsolutePath().normalize())
                    .forEach(found::add);
            } catch (IOException e) {
                throw new SourceCollectionException("Could not walk " + root + ": " + e.getMessage(), e);
            }
        }
        return found;
    }
}
