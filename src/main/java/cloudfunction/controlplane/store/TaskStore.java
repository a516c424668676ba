package cloudfunction.controlplane.store;

import cloudfunction.controlplane.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for task records, one document per task id.
 */
public interface TaskStore {

    void save(Task task);

    Optional<Task> findById(String taskId);

    List<Task> findAll();

    boolean delete(String taskId);
}
