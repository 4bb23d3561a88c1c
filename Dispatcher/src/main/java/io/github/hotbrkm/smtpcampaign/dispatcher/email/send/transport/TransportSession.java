package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.OutboundMessage;

/**
 * One authenticated, encrypted connection to a mail relay, used for every message of a campaign.
 * <p>
 * Not thread-safe: at most one {@link #send(OutboundMessage)} may be in flight.
 */
public interface TransportSession extends AutoCloseable {

    /**
     * Connects, upgrades the channel and authenticates.
     *
     * @throws TransportSetupException when any stage fails; the partially opened connection is already released
     */
    void open(RelayEndpoint endpoint, Credentials credentials);

    /**
     * Hands one message to the relay. Does not retry.
     *
     * @throws TransportSendException when the relay rejects the transaction or the connection fails
     * @throws IllegalStateException  when the session is not open
     */
    void send(OutboundMessage message) throws TransportSendException;

    boolean isOpen();

    /**
     * Releases the connection. A no-op when the session was never opened or is already closed.
     */
    @Override
    void close();
}
