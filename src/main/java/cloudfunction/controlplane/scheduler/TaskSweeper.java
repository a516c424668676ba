package cloudfunction.controlplane.scheduler;

import cloudfunction.controlplane.service.TaskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background job that deletes persisted task records past the retention period.
 */
public class TaskSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskSweeper.class);

    private final TaskManager taskManager;
    private final int retentionDays;

    public TaskSweeper(TaskManager taskManager, int retentionDays) {
        this.taskManager = taskManager;
        this.retentionDays = retentionDays;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Task sweeper error", e);
        }
    }

    /**
     * @return number of task records deleted
     */
    public int sweep() {
        int removed = taskManager.cleanupOldTasks(retentionDays);
        if (removed > 0) {
            log.info("Task sweeper removed {} records older than {} days", removed, retentionDays);
        } else {
            log.debug("No expired task records");
        }
        return removed;
    }
}
