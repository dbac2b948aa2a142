package com.inkguess.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.inkguess.store.InMemoryUserStore;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serves {@code POST /api/login} and passes the WebSocket upgrade request on.
 *
 * The login body is either JSON {@code {"login": ".."}} or a form {@code login=..};
 * the answer is {@code {"token": ".."}}. Responses allow any origin.
 */
public class LoginHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(LoginHttpHandler.class);

    public static final String LOGIN_PATH = "/api/login";

    private final InMemoryUserStore userStore;
    private final ObjectMapper objectMapper;
    private final String websocketPath;

    public LoginHttpHandler(InMemoryUserStore userStore, ObjectMapper objectMapper, String websocketPath) {
        super(false);
        this.userStore = userStore;
        this.objectMapper = objectMapper;
        this.websocketPath = websocketPath;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();

        if (path.equals(websocketPath)) {
            // Released by the WebSocket handshaker further down the pipeline
            ctx.fireChannelRead(request);
            return;
        }

        try {
            if (!path.equals(LOGIN_PATH)) {
                respond(ctx, request, HttpResponseStatus.NOT_FOUND, error("Not found"));
            } else if (HttpMethod.OPTIONS.equals(request.method())) {
                respond(ctx, request, HttpResponseStatus.NO_CONTENT, null);
            } else if (!HttpMethod.POST.equals(request.method())) {
                respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, error("Use POST"));
            } else {
                login(ctx, request);
            }
        } finally {
            request.release();
        }
    }

    private void login(ChannelHandlerContext ctx, FullHttpRequest request) {
        String body = request.content().toString(StandardCharsets.UTF_8);
        String login = extractLogin(body, request.headers().get(HttpHeaderNames.CONTENT_TYPE));
        if (login == null || login.isBlank()) {
            logger.warn("Login request without a login from {}", ctx.channel().remoteAddress());
            respond(ctx, request, HttpResponseStatus.BAD_REQUEST, error("Login is required"));
            return;
        }

        String token = userStore.issueToken(login);
        ObjectNode response = objectMapper.createObjectNode();
        response.put("token", token);
        respond(ctx, request, HttpResponseStatus.OK, response);
    }

    /**
     * Reads the login from a JSON or form encoded body, or null if absent or unreadable.
     */
    String extractLogin(String body, String contentType) {
        if (body == null || body.isBlank()) {
            return null;
        }
        boolean json = contentType != null
                ? contentType.startsWith(HttpHeaderValues.APPLICATION_JSON.toString())
                : body.trim().startsWith("{");
        if (json) {
            try {
                JsonNode node = objectMapper.readTree(body);
                return node != null && node.hasNonNull("login") ? node.get("login").asText() : null;
            } catch (JsonProcessingException e) {
                logger.debug("Unreadable login body: {}", e.getOriginalMessage());
                return null;
            }
        }
        List<String> values = new QueryStringDecoder(body, StandardCharsets.UTF_8, false)
                .parameters().get("login");
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private ObjectNode error(String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", message);
        return node;
    }

    private void respond(ChannelHandlerContext ctx, FullHttpRequest request,
                         HttpResponseStatus status, JsonNode body) {
        byte[] bytes = new byte[0];
        if (body != null) {
            try {
                bytes = objectMapper.writeValueAsBytes(body);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Serialization failed", e);
            }
        }

        FullHttpResponse response = new DefaultFullHttpResponse(
                request.protocolVersion(), status, Unpooled.wrappedBuffer(bytes));
        response.headers()
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "POST, OPTIONS")
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        if (body != null) {
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        }

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("HTTP error", cause);
        ctx.close();
    }
}
