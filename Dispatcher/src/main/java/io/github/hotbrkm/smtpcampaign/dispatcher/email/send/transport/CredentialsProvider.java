package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

/**
 * Source of the relay credentials. The core never stores them.
 */
@FunctionalInterface
public interface CredentialsProvider {

    Credentials getCredentials();
}
