package com.inkguess.protocol;

import com.inkguess.session.ClientSession;

/**
 * Typed dispatch of server messages over the transport.
 *
 * Only connections bound to a player identity receive broadcasts.
 */
public interface MessageBus {

    /**
     * Sends to the connection currently bound to {@code identity}, if any.
     */
    void send(String identity, Message message);

    /**
     * Sends to one specific connection, bound or not.
     */
    void send(ClientSession session, Message message);

    void broadcast(Message message);

    void broadcastExcept(String excludedIdentity, Message message);
}
