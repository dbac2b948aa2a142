package com.inkguess.session;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.UUID;

/**
 * Represents one WebSocket connection.
 *
 * A session starts unauthenticated; after a successful handshake the
 * {@link ConnectionRegistry} binds it to a player identity. The identity field is
 * only written on the game loop.
 */
public class ClientSession {

    private final String sessionId;
    private final Channel channel;
    private final long connectedAt;

    private volatile String identity;

    public ClientSession(Channel channel) {
        this.sessionId = UUID.randomUUID().toString();
        this.channel = channel;
        this.connectedAt = System.currentTimeMillis();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Channel getChannel() {
        return channel;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    /**
     * The bound player name, or null while unauthenticated.
     */
    public String getIdentity() {
        return identity;
    }

    void setIdentity(String identity) {
        this.identity = identity;
    }

    public boolean isAuthenticated() {
        return identity != null;
    }

    /**
     * Sends a text message to this client via the WebSocket channel.
     * Thread-safe - Netty queues writes issued outside the channel's event loop.
     */
    public void send(String message) {
        if (channel.isActive()) {
            channel.writeAndFlush(new TextWebSocketFrame(message));
        }
    }

    /**
     * Checks if the session is still active (channel open).
     */
    public boolean isActive() {
        return channel != null && channel.isActive();
    }

    /**
     * Force-closes the underlying connection.
     */
    public void close() {
        if (channel != null) {
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "ClientSession{" +
                "sessionId='" + sessionId + '\'' +
                ", identity='" + identity + '\'' +
                ", active=" + isActive() +
                '}';
    }
}
