package cloudfunction.environment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal {@code .env} reader: {@code KEY=VALUE} lines, optional {@code export} prefix,
 * optional single or double quotes around the value, {@code #} comment lines.
 */
public final class DotEnvParser {

    private DotEnvParser() {
    }

    public static Map<String, String> parse(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            values.put(key, unquote(value));
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        int hash = value.indexOf(" #");
        return hash >= 0 ? value.substring(0, hash).trim() : value;
    }
}
