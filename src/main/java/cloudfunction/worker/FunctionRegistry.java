package cloudfunction.worker;

import cloudfunction.common.FunctionLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Functions of one project, owned by its worker.
 * A function that fails to load stays registered and is retried on first use.
 */
public final class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final String project;
    private final HandlerResolver resolver;
    private final ClassLoader loader;
    private final Map<String, String> env;
    private final Map<String, RegisteredFunction> functions = new LinkedHashMap<>();

    public FunctionRegistry(String project, HandlerResolver resolver, ClassLoader loader, Map<String, String> env) {
        this.project = project;
        this.resolver = resolver;
        this.loader = loader;
        this.env = env;
    }

    /**
     * Registers every function file of the project directory.
     *
     * @return number of registered functions
     */
    public synchronized int scan(Path projectDir) throws IOException {
        for (Path file : resolver.listFunctionFiles(projectDir)) {
            String name = FunctionDescriptor.functionName(file);
            RegisteredFunction fn = new RegisteredFunction(name, file);
            functions.put(name, fn);
            try {
                fn.described(resolver.describe(file));
            } catch (FunctionLoadException e) {
                log.error("Failed to register function {} of project {}: {}", name, project, e.getMessage());
                fn.failed(e.getMessage());
            }
        }
        return functions.size();
    }

    /**
     * Eagerly loads every registered function; failures are recorded, not thrown.
     *
     * @return number of functions loaded
     */
    public synchronized int loadAll() {
        int loaded = 0;
        for (RegisteredFunction fn : functions.values()) {
            try {
                load(fn);
                loaded++;
            } catch (FunctionLoadException e) {
                log.error("Failed to load function {} of project {}: {}", fn.name(), project, e.getMessage());
            }
        }
        return loaded;
    }

    public synchronized Optional<RegisteredFunction> get(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Returns a callable handler, loading (or retrying) the function when needed.
     *
     * @throws FunctionLoadException if the function still cannot be loaded
     */
    public synchronized FunctionHandler ensureLoaded(String name) {
        RegisteredFunction fn = functions.get(name);
        if (fn == null) {
            throw new FunctionLoadException("Function " + name + " not found in project " + project);
        }
        if (fn.status() == FunctionStatus.LOADED) {
            return fn.handler();
        }
        return load(fn);
    }

    public synchronized List<RegisteredFunction> list() {
        return new ArrayList<>(functions.values());
    }

    private FunctionHandler load(RegisteredFunction fn) {
        try {
            if (fn.descriptor() == null) {
                fn.described(resolver.describe(fn.file()));
            }
            FunctionHandler handler = resolver.resolve(fn.descriptor(), loader, env);
            fn.loaded(handler);
            return handler;
        } catch (FunctionLoadException e) {
            fn.failed(e.getMessage());
            throw e;
        }
    }
}
