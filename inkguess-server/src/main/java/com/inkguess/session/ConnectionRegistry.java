package com.inkguess.session;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open connections and the identity each one is bound to.
 *
 * Two layers:
 * - channel → session: every open channel, written from Netty I/O threads
 * - identity ↔ session: authenticated players, at most one connection per identity,
 *   written only from the game loop
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, ClientSession> sessionsByChannelId = new ConcurrentHashMap<>();

    private final Map<String, ClientSession> sessionsByIdentity = new ConcurrentHashMap<>();

    /**
     * Creates and registers a new session for a connected channel.
     */
    public ClientSession createSession(Channel channel) {
        ClientSession session = new ClientSession(channel);
        String channelId = channel.id().asLongText();
        sessionsByChannelId.put(channelId, session);

        logger.debug("Session created: {} (channel: {})", session.getSessionId(), channelId);
        return session;
    }

    /**
     * Removes the session of a closed channel. Identity bindings are left to
     * {@link #unbind(ClientSession)}, which runs on the game loop.
     *
     * @return The removed session, or null if not found
     */
    public ClientSession removeSession(Channel channel) {
        String channelId = channel.id().asLongText();
        ClientSession session = sessionsByChannelId.remove(channelId);
        if (session != null) {
            logger.debug("Session removed: {} (channel: {})", session.getSessionId(), channelId);
        }
        return session;
    }

    public ClientSession getSessionByChannel(Channel channel) {
        return sessionsByChannelId.get(channel.id().asLongText());
    }

    /**
     * Binds an identity to a session. A different session already bound to the same
     * identity is evicted and its connection closed. An identity previously bound to
     * this session is released.
     *
     * @return the evicted session, or null
     */
    public ClientSession bind(String identity, ClientSession session) {
        String stale = session.getIdentity();
        if (stale != null && !stale.equals(identity)) {
            sessionsByIdentity.remove(stale, session);
        }
        ClientSession previous = sessionsByIdentity.put(identity, session);
        session.setIdentity(identity);

        if (previous != null && previous != session) {
            previous.setIdentity(null);
            logger.info("Duplicate login for {}, closing older session {}",
                    identity, previous.getSessionId());
            previous.close();
            return previous;
        }
        return null;
    }

    /**
     * Releases the identity bound to a session.
     *
     * @return the freed identity, or null if the session was unauthenticated or already evicted
     */
    public String unbind(ClientSession session) {
        String identity = session.getIdentity();
        if (identity == null) {
            return null;
        }
        if (!sessionsByIdentity.remove(identity, session)) {
            return null;
        }
        session.setIdentity(null);
        return identity;
    }

    public ClientSession sessionFor(String identity) {
        return identity == null ? null : sessionsByIdentity.get(identity);
    }

    /**
     * Resolves the identity of a session by reverse lookup.
     */
    public String identityOf(ClientSession session) {
        String identity = session.getIdentity();
        return identity != null && sessionsByIdentity.get(identity) == session ? identity : null;
    }

    /**
     * Snapshot of the bound identities.
     */
    public List<String> boundIdentities() {
        return new ArrayList<>(sessionsByIdentity.keySet());
    }

    public Collection<ClientSession> getAllSessions() {
        return sessionsByChannelId.values();
    }

    public int getSessionCount() {
        return sessionsByChannelId.size();
    }

    public int getBoundCount() {
        return sessionsByIdentity.size();
    }
}
