package com.flowtrace.engine.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class SourceRootResolverTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/java-invoicing");

    private final SourceRootResolver resolver = new SourceRootResolver();

    @Test
    void mavenProjectResolvesDeclaredSourceRoot() {
        SourceRoots roots = resolver.resolve(FIXTURE_ROOT);
        assertEquals(1, roots.sourceRoots().size());
        assertTrue(roots.sourceRoots().get(0).endsWith("src/main/java"),
            "Expected source root to end with src/main/java but got: " + roots.sourceRoots());
    }

    @Test
    void directoryWithoutBuildFileIsScannedWhole(@TempDir Path tmp) {
        SourceRoots roots = resolver.resolve(tmp);
        assertEquals(tmp.toAbsolutePath().normalize().toString(), roots.sourceRoots().get(0));
    }

    @Test
    void unreadablePomFallsBackToDefaults(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), "<project><build>");
        Files.createDirectories(tmp.resolve("src/main/java"));
        Files.createDirectories(tmp.resolve("src/test/java"));
        SourceRoots roots = resolver.resolve(tmp);
        assertEquals(2, roots.sourceRoots().size());
        assertTrue(roots.sourceRoots().get(1).endsWith("src/test/java"));
    }
}
