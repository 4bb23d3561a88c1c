package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

/**
 * Creates an unopened session per campaign.
 */
@FunctionalInterface
public interface TransportSessionFactory {

    TransportSession create();
}
