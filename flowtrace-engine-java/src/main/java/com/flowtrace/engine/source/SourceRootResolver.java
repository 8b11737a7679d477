package com.flowtrace.engine.source;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which directories of a scope to scan. A Maven project contributes the source and
 * test directories its pom.xml declares (Maven defaults when absent); anything else is scanned whole.
 */
public class SourceRootResolver {

    public SourceRoots resolve(Path scope) {
        Path root = scope.toAbsolutePath().normalize();
        Path pomFile = root.resolve("pom.xml");
        if (Files.isRegularFile(pomFile)) {
            List<String> roots = resolveMaven(root, pomFile);
            if (!roots.isEmpty()) {
                return new SourceRoots(root.toString(), roots);
            }
        }
        return new SourceRoots(root.toString(), List.of(root.toString()));
    }

    private List<String> resolveMaven(Path root, Path pomFile) {
        String sourceDir = "src/main/java";
        String testDir = "src/test/java";
        try (FileReader reader = new FileReader(pomFile.toFile())) {
            Model model = new MavenXpp3Reader().read(reader);
            Build build = model.getBuild();
            if (build != null && build.getSourceDirectory() != null) {
                sourceDir = build.getSourceDirectory();
            }
            if (build != null && build.getTestSourceDirectory() != null) {
                testDir = build.getTestSourceDirectory();
            }
        } catch (IOException | XmlPullParserException e) {
            System.err.println("[flowtrace] Warning: could not parse pom.xml, using default source roots: "
                + e.getMessage());
        }

        List<String> roots = new ArrayList<>();
        for (String dir : List.of(sourceDir, testDir)) {
            Path resolved = root.resolve(dir).normalize();
            if (Files.isDirectory(resolved)) {
                roots.add(resolved.toString());
            }
        }
        return roots;
    }
}
