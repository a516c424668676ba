package cloudfunction.controlplane.scheduler;

import cloudfunction.common.Jsons;
import cloudfunction.common.Names;
import cloudfunction.controlplane.model.ScheduledJob;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads schedule documents:
 *
 * <pre>
 * jobs:
 *   nightly-report:
 *     project: demo
 *     function: report
 *     args: {full: true}
 *     cron: {hour: "2", minute: "30"}
 * </pre>
 *
 * The system-wide file is read first, then {@code <project>/schedule.yaml} for every project;
 * per-project jobs get the id {@code <project>/<job>} and may omit {@code project}.
 * Invalid jobs are logged and skipped.
 */
public class ScheduleDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(ScheduleDefinitionLoader.class);

    public static final String PROJECT_FILE = "schedule.yaml";

    public List<ScheduledJob> load(Path systemFile, Path projectsDir) {
        List<ScheduledJob> jobs = new ArrayList<>(loadFile(systemFile, null));
        for (Path dir : projectDirs(projectsDir)) {
            jobs.addAll(loadFile(dir.resolve(PROJECT_FILE), dir.getFileName().toString()));
        }
        log.info("Loaded {} scheduled jobs", jobs.size());
        return jobs;
    }

    /**
     * @param owningProject project the file belongs to, or null for the system-wide file
     */
    public List<ScheduledJob> loadFile(Path file, String owningProject) {
        if (file == null || !Files.isRegularFile(file)) {
            return List.of();
        }
        JsonNode root;
        try {
            root = Jsons.yaml().readTree(file.toFile());
        } catch (IOException e) {
            log.error("Cannot read schedule file {}: {}", file, e.getMessage());
            return List.of();
        }
        JsonNode jobsNode = root == null ? null : root.get("jobs");
        if (jobsNode == null || jobsNode.isNull()) {
            return List.of();
        }
        if (!jobsNode.isObject()) {
            log.error("Schedule file {}: 'jobs' must be a mapping", file);
            return List.of();
        }

        List<ScheduledJob> jobs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = jobsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String id = owningProject == null ? entry.getKey() : owningProject + "/" + entry.getKey();
            try {
                ScheduledJob job = parseJob(id, entry.getValue(), owningProject);
                if (job != null) {
                    jobs.add(job);
                }
            } catch (IllegalArgumentException e) {
                log.error("Skipping scheduled job {} in {}: {}", id, file, e.getMessage());
            }
        }
        return jobs;
    }

    ScheduledJob parseJob(String id, JsonNode node, String owningProject) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("job definition must be a mapping");
        }
        if (!node.path("enabled").asBoolean(true)) {
            log.info("Scheduled job {} is disabled", id);
            return null;
        }

        String project = text(node, "project");
        if (owningProject != null) {
            if (project != null && !project.equals(owningProject)) {
                log.warn("Scheduled job {} names project {}, using {}", id, project, owningProject);
            }
            project = owningProject;
        }
        Names.requireValid("project", project);
        String function = Names.requireValid("function", text(node, "function"));

        JsonNode cronNode = node.get("cron");
        if (cronNode == null || !cronNode.isObject()) {
            throw new IllegalArgumentException("missing 'cron' mapping");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        cronNode.fields().forEachRemaining(f -> fields.put(f.getKey(), f.getValue().asText()));

        JsonNode args = node.get("args");
        if (args == null || args.isNull()) {
            args = JsonNodeFactory.instance.objectNode();
        }
        return new ScheduledJob(id, project, function, args, CronTrigger.of(fields));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static List<Path> projectDirs(Path projectsDir) {
        if (projectsDir == null || !Files.isDirectory(projectsDir)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(projectsDir)) {
            return dirs.filter(Files::isDirectory)
                    .filter(p -> Names.isValid(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Cannot list projects in {}: {}", projectsDir, e.getMessage());
            return List.of();
        }
    }
}
