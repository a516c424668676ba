package cloudfunction.controlplane.registry;

import cloudfunction.common.ConfigurationException;

/**
 * Fixed component slots of the {@link CoordinationRegistry}.
 */
public enum ComponentName {
    REGISTRY("registry"),
    MASTER("master"),
    PROJECT_MANAGER("project_manager"),
    API_SERVER("api_server"),
    TASK_MANAGER("task_manager");

    private final String slotName;

    ComponentName(String slotName) {
        this.slotName = slotName;
    }

    public String slotName() {
        return slotName;
    }

    /**
     * @throws ConfigurationException for names outside the fixed set
     */
    public static ComponentName fromName(String name) {
        for (ComponentName c : values()) {
            if (c.slotName.equals(name)) {
                return c;
            }
        }
        throw new ConfigurationException("Unknown component: " + name);
    }
}
