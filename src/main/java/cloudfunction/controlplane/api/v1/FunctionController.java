package cloudfunction.controlplane.api.v1;

import cloudfunction.common.Jsons;
import cloudfunction.controlplane.api.Controller;
import cloudfunction.controlplane.core.FunctionInvoker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Synchronous invocation.
 *
 * POST /api/v1/functions/{project}/{function}/invoke - body is the payload
 */
public class FunctionController implements Controller {

    private static final Pattern INVOKE_PATTERN = Pattern.compile("^/api/v1/functions/([^/]+)/([^/]+)/invoke$");

    private final FunctionInvoker invoker;

    public FunctionController(FunctionInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && INVOKE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher m = INVOKE_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown function endpoint");
        }
        JsonNode payload = readPayload(req);
        JsonNode result = invoker.executeFunction(m.group(1), m.group(2), payload);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("result", result);
        return ControllerResponse.json(response);
    }

    static JsonNode readPayload(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return NullNode.getInstance();
        }
        return Jsons.mapper().readTree(body);
    }
}
