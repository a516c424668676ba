package cloudfunction.controlplane.server;

import cloudfunction.common.FunctionExecutionException;
import cloudfunction.common.FunctionLoadException;
import cloudfunction.common.FunctionTimeoutException;
import cloudfunction.common.Jsons;
import cloudfunction.common.ProjectNotFoundException;
import cloudfunction.common.ProjectUnavailableException;
import cloudfunction.common.ProvisioningException;
import cloudfunction.controlplane.api.Controller;
import cloudfunction.controlplane.api.Controller.ControllerResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.GATEWAY_TIMEOUT;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.SERVICE_UNAVAILABLE;
import static io.netty.handler.codec.http.HttpResponseStatus.UNPROCESSABLE_ENTITY;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers
 * and maps domain exceptions to status codes.
 *
 * This handler is @Sharable because it has no per-channel state. Controllers run on the
 * dispatch executor (the calling thread unless {@link #dispatchOn} is used); responses are
 * written back through the channel context.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new ArrayList<>();
    private volatile Executor dispatcher = Runnable::run;

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public RouterHandler dispatchOn(Executor executor) {
        this.dispatcher = executor;
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        FullHttpRequest request = req.retain();
        try {
            dispatcher.execute(() -> {
                try {
                    process(ctx, request);
                } finally {
                    request.release();
                }
            });
        } catch (RejectedExecutionException e) {
            request.release();
            log.warn("Rejected {} {}: dispatcher is shut down", req.method(), req.uri());
            writeSafe(ctx, SERVICE_UNAVAILABLE, "application/json",
                    Jsons.toJson(Map.of("error", "server is shutting down")));
        }
    }

    private void process(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        ControllerResponse response;
        try {
            response = route(ctx, req, method, path);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.errorResponse(BAD_REQUEST, e.getMessage());
        } catch (ProjectNotFoundException e) {
            response = ControllerResponse.errorResponse(NOT_FOUND, e.getMessage());
        } catch (FunctionLoadException | ProvisioningException e) {
            response = ControllerResponse.errorResponse(UNPROCESSABLE_ENTITY, e.getMessage());
        } catch (FunctionExecutionException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "error");
            body.put("error", e.getMessage());
            response = ControllerResponse.json(INTERNAL_SERVER_ERROR, body);
        } catch (ProjectUnavailableException e) {
            log.warn("{} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.errorResponse(SERVICE_UNAVAILABLE, e.getMessage());
        } catch (FunctionTimeoutException e) {
            response = ControllerResponse.errorResponse(GATEWAY_TIMEOUT, e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            response = ControllerResponse.error(e.toString());
        }
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method, String path)
            throws Exception {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(ctx, req, path);
            }
        }
        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.notFound("not found");
    }

    /**
     * Safe write that catches any exceptions during response writing.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    Jsons.toJson(Map.of("error", "channel error: " + cause.getMessage())));
        } finally {
            ctx.close();
        }
    }
}
