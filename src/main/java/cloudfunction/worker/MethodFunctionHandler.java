package cloudfunction.worker;

import cloudfunction.common.Jsons;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Calls a public static method. The payload is converted to the method's first parameter type;
 * a second {@code Map<String, String>} parameter receives the project environment.
 */
final class MethodFunctionHandler implements FunctionHandler {

    private final Method method;
    private final JavaType payloadType;
    private final Map<String, String> env;
    private final boolean async;

    MethodFunctionHandler(Method method, Map<String, String> env) {
        this.method = method;
        this.payloadType = Jsons.mapper().getTypeFactory().constructType(method.getGenericParameterTypes()[0]);
        this.env = method.getParameterCount() == 2 ? env : null;
        this.async = CompletionStage.class.isAssignableFrom(method.getReturnType());
    }

    @Override
    public boolean isAsync() {
        return async;
    }

    @Override
    public Object invoke(JsonNode payload) throws Exception {
        Object arg = payloadType.isTypeOrSubTypeOf(JsonNode.class)
                ? payload
                : Jsons.mapper().convertValue(payload, payloadType);
        try {
            return env == null ? method.invoke(null, arg) : method.invoke(null, arg, env);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getName() + "." + method.getName();
    }
}
