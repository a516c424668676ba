package cloudfunction.worker;

import cloudfunction.common.FunctionLoadException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Turns function source locations into callable handlers.
 */
public interface HandlerResolver {

    /**
     * Function files of a project, in a stable order.
     */
    List<Path> listFunctionFiles(Path projectDir) throws IOException;

    /**
     * @throws FunctionLoadException if the file is not a valid function source
     */
    FunctionDescriptor describe(Path file);

    /**
     * Resolves the descriptor's entry point against the project's class loader.
     * {@code env} is bound for entry points that take the environment map as a second argument.
     *
     * @throws FunctionLoadException if the entry point cannot be resolved
     */
    FunctionHandler resolve(FunctionDescriptor descriptor, ClassLoader loader, Map<String, String> env);
}
