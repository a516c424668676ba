package cloudfunction.environment;

import cloudfunction.common.ProvisioningException;

/**
 * Creates and maintains isolated per-project environments.
 */
public interface EnvironmentProvisioner {

    /**
     * Creates the environment for a project if it does not exist yet.
     *
     * @throws ProvisioningException if the project is unknown or the environment cannot be created
     */
    EnvironmentHandle ensureEnvironment(String project);

    /**
     * Installs the merged system and project dependencies into the environment.
     *
     * @throws ProvisioningException if a dependency cannot be installed
     */
    void installDependencies(String project, EnvironmentHandle handle);

    /**
     * Deletes the project's environment. Missing environments are ignored.
     */
    void removeEnvironment(String project);
}
