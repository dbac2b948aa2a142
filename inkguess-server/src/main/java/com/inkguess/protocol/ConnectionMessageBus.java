package com.inkguess.protocol;

import com.inkguess.session.ClientSession;
import com.inkguess.session.ConnectionRegistry;

/**
 * {@link MessageBus} writing JSON text frames to the sessions of a {@link ConnectionRegistry}.
 *
 * Broadcasts serialize the message once and reuse the string for every recipient.
 */
public class ConnectionMessageBus implements MessageBus {

    private final ConnectionRegistry registry;
    private final MessageSerializer serializer;

    public ConnectionMessageBus(ConnectionRegistry registry, MessageSerializer serializer) {
        this.registry = registry;
        this.serializer = serializer;
    }

    @Override
    public void send(String identity, Message message) {
        ClientSession session = registry.sessionFor(identity);
        if (session != null) {
            session.send(serializer.serialize(message));
        }
    }

    @Override
    public void send(ClientSession session, Message message) {
        session.send(serializer.serialize(message));
    }

    @Override
    public void broadcast(Message message) {
        broadcastExcept(null, message);
    }

    @Override
    public void broadcastExcept(String excludedIdentity, Message message) {
        String json = serializer.serialize(message);
        for (String identity : registry.boundIdentities()) {
            if (identity.equals(excludedIdentity)) {
                continue;
            }
            ClientSession session = registry.sessionFor(identity);
            if (session != null && session.isActive()) {
                session.send(json);
            }
        }
    }
}
