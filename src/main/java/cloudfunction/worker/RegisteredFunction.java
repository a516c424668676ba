package cloudfunction.worker;

import java.nio.file.Path;

/**
 * A function known to a worker together with its load state.
 */
public final class RegisteredFunction {

    private final String name;
    private final Path file;
    private volatile FunctionDescriptor descriptor;
    private volatile FunctionStatus status = FunctionStatus.UNREGISTERED;
    private volatile FunctionHandler handler;
    private volatile String loadError;

    RegisteredFunction(String name, Path file) {
        this.name = name;
        this.file = file;
    }

    public String name() { return name; }
    public Path file() { return file; }
    public FunctionDescriptor descriptor() { return descriptor; }
    public FunctionStatus status() { return status; }
    public FunctionHandler handler() { return handler; }
    public String loadError() { return loadError; }

    public String description() {
        FunctionDescriptor d = descriptor;
        return d == null ? null : d.description();
    }

    void described(FunctionDescriptor descriptor) {
        this.descriptor = descriptor;
        this.status = FunctionStatus.REGISTERED;
        this.loadError = null;
    }

    void loaded(FunctionHandler handler) {
        this.handler = handler;
        this.status = FunctionStatus.LOADED;
        this.loadError = null;
    }

    void failed(String error) {
        this.loadError = error;
        if (descriptor == null) {
            this.status = FunctionStatus.UNREGISTERED;
        }
    }
}
