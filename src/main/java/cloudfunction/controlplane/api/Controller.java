package cloudfunction.controlplane.api;

import cloudfunction.common.Jsons;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request. Domain exceptions may propagate; the router maps them to status codes.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse json(Object value) {
            return json(HttpResponseStatus.OK, value);
        }

        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            return new ControllerResponse(status, "application/json", Jsons.toJson(value));
        }

        public static ControllerResponse notFound(String message) {
            return errorResponse(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse error(String message) {
            return errorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse errorResponse(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    Jsons.toJson(Map.of("error", message == null ? "" : message)));
        }
    }
}
