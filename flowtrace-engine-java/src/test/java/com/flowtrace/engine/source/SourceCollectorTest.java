package com.flowtrace.engine.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceCollectorTest {

    private final SourceCollector collector = new SourceCollector();

    private static Path write(Path file, String text) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, text);
    }

    private static List<String> names(List<Path> paths) {
        return paths.stream().map(p -> p.getFileName().toString()).toList();
    }

    @Test
    void scopeScanIsSortedAndFiltersUnsupportedFiles(@TempDir Path tmp) throws IOException {
        write(tmp.resolve("b.py"), "x = 1\n");
        write(tmp.resolve("a.py"), "y = 2\n");
        write(tmp.resolve("notes.txt"), "ignored");
        write(tmp.resolve("pkg/c.py"), "z = 3\n");

        List<Path> flat = collector.collect(List.of(), tmp, false, null, null);
        assertEquals(List.of("a.py", "b.py"), names(flat));

        List<Path> deep = collector.collect(List.of(), tmp, true, null, null);
        assertEquals(3, deep.size());
        assertTrue(names(deep).contains("c.py"));
    }

    @Test
    void includeAndExcludeGlobs(@TempDir Path tmp) throws IOException {
        write(tmp.resolve("service.py"), "");
        write(tmp.resolve("Service.java"), "class Service {}");
        write(tmp.resolve("tests/test_service.py"), "");

        List<Path> onlyPython = collector.collect(List.of(), tmp, true, "*.py", "tests/**");
        assertEquals(List.of("service.py"), names(onlyPython));
    }

    @Test
    void explicitFilesAreDeduplicatedWithScope(@TempDir Path tmp) throws IOException {
        Path a = write(tmp.resolve("a.py"), "");
        List<Path> files = collector.collect(List.of(a, a), tmp, false, null, null);
        assertEquals(1, files.size());
    }

    @Test
    void missingExplicitFileIsSkipped(@TempDir Path tmp) {
        List<Path> files = collector.collect(List.of(tmp.resolve("gone.py")), null, false, null, null);
        assertTrue(files.isEmpty());
    }

    @Test
    void skippedExplicitFilesCarryTheirReason(@TempDir Path tmp) throws IOException {
        Path notes = write(tmp.resolve("notes.txt"), "ignored");
        Path gone = tmp.resolve("gone.py");
        Path kept = write(tmp.resolve("kept.py"), "x = 1\n");

        SourceCollector.Selection selection = collector.select(List.of(notes, gone, kept), null, false, null, null);
        assertEquals(List.of("kept.py"), names(selection.files()));
        assertEquals(List.of(
            new SourceCollector.Skipped(notes, "unsupported file type"),
            new SourceCollector.Skipped(gone, "file not found")), selection.skipped());
    }

    @Test
    void scopeThatIsNotADirectoryThrows(@TempDir Path tmp) {
        assertThrows(SourceCollector.SourceCollectionException.class,
            () -> collector.collect(List.of(), tmp.resolve("missing"), false, null, null));
    }
}
