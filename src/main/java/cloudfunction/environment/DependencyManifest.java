package cloudfunction.environment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A dependency manifest: one jar path per line, {@code #} starts a comment.
 * Relative paths resolve against the manifest's directory.
 *
 * <p>Entries are keyed by artifact name (file name without version and {@code .jar}),
 * so {@code lib/gson-2.10.jar} and {@code /opt/gson-2.11.jar} name the same artifact.
 */
public final class DependencyManifest {

    public static final String FILE_NAME = "dependencies.txt";
    public static final String LOCK_FILE = "dependencies.lock";

    private static final Pattern VERSIONED = Pattern.compile("^(.+?)-\\d[^/]*$");

    private final Map<String, Path> entries;

    private DependencyManifest(Map<String, Path> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static DependencyManifest empty() {
        return new DependencyManifest(new LinkedHashMap<>());
    }

    /**
     * Reads a manifest. A missing file yields an empty manifest.
     */
    public static DependencyManifest read(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            return empty();
        }
        Path base = file.toAbsolutePath().getParent();
        Map<String, Path> entries = new LinkedHashMap<>();
        for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            Path jar = base.resolve(line).normalize();
            entries.put(artifactKey(jar.getFileName().toString()), jar);
        }
        return new DependencyManifest(entries);
    }

    /**
     * Artifact name of a jar file name: {@code gson-2.10.1.jar} becomes {@code gson}.
     */
    public static String artifactKey(String fileName) {
        String name = fileName.endsWith(".jar") ? fileName.substring(0, fileName.length() - 4) : fileName;
        Matcher m = VERSIONED.matcher(name);
        return (m.matches() ? m.group(1) : name).toLowerCase();
    }

    /**
     * Merges this manifest with a project manifest; project entries win on the same artifact.
     */
    public DependencyManifest overlay(DependencyManifest project) {
        Map<String, Path> merged = new LinkedHashMap<>(entries);
        merged.putAll(project.entries);
        return new DependencyManifest(merged);
    }

    public Map<String, Path> entries() {
        return entries;
    }

    public Collection<Path> jars() {
        return entries.values();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Lock file lines: {@code artifact=absolute path}, sorted by artifact.
     */
    public List<String> lockLines() {
        List<String> lines = new ArrayList<>();
        entries.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> lines.add(e.getKey() + "=" + e.getValue()));
        return lines;
    }

    private static String stripComment(String line) {
        int idx = line.indexOf('#');
        return idx >= 0 ? line.substring(0, idx) : line;
    }
}
