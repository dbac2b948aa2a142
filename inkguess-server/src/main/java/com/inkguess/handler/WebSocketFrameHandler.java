package com.inkguess.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.inkguess.game.GameSession;
import com.inkguess.protocol.DrawOp;
import com.inkguess.protocol.Message;
import com.inkguess.protocol.MessageSerializer;
import com.inkguess.protocol.Messages;
import com.inkguess.session.ClientSession;
import com.inkguess.session.ConnectionRegistry;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.concurrent.EventExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes WebSocket frames and hands them to the {@link GameSession}.
 *
 * Threading Model:
 * - Frames are parsed on the channel's Netty worker thread
 * - The game call itself is executed on the single game loop, so the session
 *   sees one event at a time regardless of which worker received it
 *
 * Never block in this handler.
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final ConnectionRegistry registry;
    private final GameSession game;
    private final EventExecutor gameLoop;
    private final MessageSerializer serializer;

    public WebSocketFrameHandler(ConnectionRegistry registry, GameSession game,
                                 EventExecutor gameLoop, MessageSerializer serializer) {
        this.registry = registry;
        this.game = game;
        this.gameLoop = gameLoop;
        this.serializer = serializer;
    }

    /**
     * Called when a new connection is set up.
     */
    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        ClientSession session = registry.createSession(ctx.channel());
        logger.info("New connection: {}", session.getSessionId());
    }

    /**
     * Called when the connection is closed.
     */
    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        ClientSession session = registry.removeSession(ctx.channel());
        if (session != null) {
            logger.info("Connection closed: {}", session.getSessionId());
            submit(() -> game.onDisconnect(session));
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.warn("Unsupported frame type: {}", frame.getClass().getName());
            return;
        }

        String json = ((TextWebSocketFrame) frame).text();
        ClientSession session = registry.getSessionByChannel(ctx.channel());
        if (session == null) {
            logger.error("Received message from unknown channel");
            return;
        }

        Runnable task;
        try {
            Message message = serializer.deserialize(json);
            logger.debug("Received {} from {}", message.getType(), session.getSessionId());
            task = route(session, message);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected message from {}: {}", session.getSessionId(), e.getMessage());
            sendError(session, "Invalid message format");
            return;
        }
        if (task != null) {
            submit(task);
        }
    }

    /**
     * Maps a client message to the game call it triggers, or answers with an error for
     * types only the server may send.
     *
     * @return the task to run on the game loop, or null
     */
    private Runnable route(ClientSession session, Message message) {
        JsonNode payload = message.getPayload();
        return switch (message.getType()) {
            case HANDSHAKE -> {
                String token = text(payload, "token");
                yield () -> game.onHandshake(session, token);
            }
            case DRAW -> {
                DrawOp op = DrawOp.fromPayload(payload);
                yield () -> game.onDraw(session, op);
            }
            case CHAT -> {
                String sender = text(payload, "sender");
                String text = text(payload, "text");
                String color = text(payload, "color");
                yield () -> game.onChat(session, sender, text, color);
            }
            case WORD -> {
                String word = text(payload, "word");
                yield () -> game.onWordChosen(session, word);
            }
            case WORD_CHOICES, START_ROUND, END_ROUND, PLAYER, PLAYER_DISCONNECTED,
                    TIMER, GAME_OVER, ERROR -> {
                sendError(session, "Unsupported message type: " + message.getType());
                yield null;
            }
        };
    }

    private static String text(JsonNode payload, String field) {
        return payload != null && payload.hasNonNull(field) ? payload.get(field).asText() : null;
    }

    /**
     * Runs a game call on the game loop. Failures are logged so one bad event cannot
     * stop the loop.
     */
    private void submit(Runnable task) {
        gameLoop.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Game event failed", e);
            }
        });
    }

    private void sendError(ClientSession session, String errorMessage) {
        session.send(serializer.serialize(Messages.error(errorMessage)));
    }

    /**
     * Handles idle state events (heartbeat timeout).
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("WebSocket error", cause);
        ctx.close();
    }
}
