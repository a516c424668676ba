package cloudfunction.controlplane.store;

import cloudfunction.common.CloudFunctionException;
import cloudfunction.common.Jsons;
import cloudfunction.controlplane.model.Task;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each task as {@code <tasksDir>/<task_id>.json}. Writes go to a temp file
 * first and are moved into place, so readers never see a half-written record.
 */
public class FileTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(FileTaskStore.class);
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectWriter writer = Jsons.mapper().writerWithDefaultPrettyPrinter();

    public FileTaskStore(Path dir) {
        this.dir = dir;
    }

    public Path dir() {
        return dir;
    }

    @Override
    public void save(Task task) {
        Path target = fileFor(task.taskId());
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, task.taskId(), ".tmp");
            try {
                writer.writeValue(tmp.toFile(), TaskDocument.from(task));
                move(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new CloudFunctionException("Failed to save task " + task.taskId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        if (!isValidId(taskId)) {
            return Optional.empty();
        }
        Path file = fileFor(taskId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return read(file);
    }

    @Override
    public List<Task> findAll() {
        List<Task> tasks = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return tasks;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files.sorted()::iterator) {
                if (file.getFileName().toString().endsWith(SUFFIX)) {
                    read(file).ifPresent(tasks::add);
                }
            }
        } catch (IOException e) {
            throw new CloudFunctionException("Failed to list tasks in " + dir + ": " + e.getMessage(), e);
        }
        return tasks;
    }

    @Override
    public boolean delete(String taskId) {
        try {
            return Files.deleteIfExists(fileFor(taskId));
        } catch (IOException e) {
            throw new CloudFunctionException("Failed to delete task " + taskId + ": " + e.getMessage(), e);
        }
    }

    private Optional<Task> read(Path file) {
        try {
            return Optional.of(Jsons.mapper().readValue(file.toFile(), TaskDocument.class).toTask());
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping unreadable task file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Ids that cannot name a file directly under the store directory are invalid. */
    private static boolean isValidId(String taskId) {
        return taskId != null && !taskId.isBlank()
                && !taskId.contains("/") && !taskId.contains("\\") && !taskId.contains("..");
    }

    private Path fileFor(String taskId) {
        if (!isValidId(taskId)) {
            throw new IllegalArgumentException("invalid task id: " + taskId);
        }
        return dir.resolve(taskId + SUFFIX);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
