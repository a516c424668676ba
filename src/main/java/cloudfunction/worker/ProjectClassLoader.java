package cloudfunction.worker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Class loader for a project: {@code <project>/classes}, {@code <project>/lib/*.jar}
 * and the installed environment jars, in that order.
 */
public final class ProjectClassLoader {

    private ProjectClassLoader() {
    }

    public static URLClassLoader create(String project, Path projectDir, Path envLibDir, ClassLoader parent) {
        List<URL> urls = new ArrayList<>();
        try {
            Path classes = projectDir.resolve("classes");
            if (Files.isDirectory(classes)) {
                urls.add(classes.toUri().toURL());
            }
            addJars(projectDir.resolve("lib"), urls);
            if (envLibDir != null) {
                addJars(envLibDir, urls);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot build class path for project " + project, e);
        }
        return new URLClassLoader("project-" + project, urls.toArray(new URL[0]), parent);
    }

    private static void addJars(Path dir, List<URL> urls) throws IOException {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files.sorted()::iterator) {
                if (p.getFileName().toString().endsWith(".jar")) {
                    urls.add(toUrl(p));
                }
            }
        }
    }

    private static URL toUrl(Path p) throws MalformedURLException {
        return p.toUri().toURL();
    }
}
