package cloudfunction.controlplane.model;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void builderDefaultsAndRequiredFields() {
        Task task = Task.builder().taskId("p_f_1").projectName("p").functionName("f").build();

        assertEquals(TaskStatus.CREATED, task.status());
        assertTrue(task.isActive());
        assertFalse(task.isTerminal());
        assertTrue(task.isFor("p", "f"));
        assertFalse(task.isFor("p", "g"));
        assertThrows(NullPointerException.class, () -> Task.builder().projectName("p").functionName("f").build());
    }

    @Test
    @DisplayName("toBuilder copies every field and equality is by id")
    void toBuilderAndEquality() {
        Task task = Task.builder().taskId("p_f_1").projectName("p").functionName("f").error("e").build();
        Task failed = task.toBuilder().status(TaskStatus.FAILED).build();

        assertEquals(task, failed);
        assertEquals(task.hashCode(), failed.hashCode());
        assertEquals("e", failed.error());
        assertTrue(failed.isTerminal());
    }

    @Test
    void newTaskIdEmbedsProjectAndFunction() {
        String a = Task.newTaskId("demo", "echo");
        String b = Task.newTaskId("demo", "echo");

        assertTrue(a.startsWith("demo_echo_"));
        assertNotEquals(a, b);
    }

    @Test
    void statusWireNames() {
        assertEquals("cancelled", TaskStatus.CANCELLED.wireName());
        assertEquals(TaskStatus.RUNNING, TaskStatus.fromString("RUNNING"));
        assertEquals(TaskStatus.RUNNING, TaskStatus.fromString("running"));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromString("paused"));
        assertTrue(TaskStatus.CREATED.isActive());
        assertFalse(TaskStatus.COMPLETED.isActive());
    }
}
