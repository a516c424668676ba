package cloudfunction.worker;

import cloudfunction.common.FunctionLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves {@code <function>.function.json} descriptors to public static methods.
 *
 * <p>Accepted entry point shapes:
 * <pre>
 * public static R main(P payload)
 * public static R main(P payload, Map&lt;String, String&gt; env)
 * </pre>
 * Returning a {@link java.util.concurrent.CompletionStage} makes the handler asynchronous.
 * Descriptors whose name starts with {@code _} are skipped.
 */
public class ClassHandlerResolver implements HandlerResolver {

    private static final Logger log = LoggerFactory.getLogger(ClassHandlerResolver.class);

    @Override
    public List<Path> listFunctionFiles(Path projectDir) throws IOException {
        if (!Files.isDirectory(projectDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(projectDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(FunctionDescriptor.SUFFIX))
                    .filter(p -> !p.getFileName().toString().startsWith("_"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public FunctionDescriptor describe(Path file) {
        return FunctionDescriptor.read(file);
    }

    @Override
    public FunctionHandler resolve(FunctionDescriptor descriptor, ClassLoader loader, Map<String, String> env) {
        Class<?> type;
        try {
            type = Class.forName(descriptor.className(), true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new FunctionLoadException("Class " + descriptor.className() + " for function "
                    + descriptor.name() + " cannot be loaded: " + e, e);
        }

        List<Method> candidates = new ArrayList<>();
        for (Method m : type.getMethods()) {
            if (m.getName().equals(descriptor.entry()) && Modifier.isStatic(m.getModifiers()) && acceptsArguments(m)) {
                candidates.add(m);
            }
        }
        if (candidates.isEmpty()) {
            throw new FunctionLoadException("Class " + type.getName() + " has no public static entry point '"
                    + descriptor.entry() + "' for function " + descriptor.name());
        }
        // Prefer the variant that takes the environment
        candidates.sort((a, b) -> Integer.compare(b.getParameterCount(), a.getParameterCount()));
        Method entry = candidates.get(0);
        log.debug("Resolved function {} to {}.{}", descriptor.name(), type.getName(), entry.getName());
        return new MethodFunctionHandler(entry, env);
    }

    private static boolean acceptsArguments(Method m) {
        if (m.getParameterCount() == 1) {
            return true;
        }
        if (m.getParameterCount() != 2 || !Map.class.equals(m.getParameterTypes()[1])) {
            return false;
        }
        Type second = m.getGenericParameterTypes()[1];
        if (second instanceof ParameterizedType pt) {
            Type[] args = pt.getActualTypeArguments();
            return args[0].equals(String.class) && args[1].equals(String.class);
        }
        return true;
    }
}
