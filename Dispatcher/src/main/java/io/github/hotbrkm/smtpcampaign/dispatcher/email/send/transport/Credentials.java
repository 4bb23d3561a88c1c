package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

import java.util.Objects;

/**
 * Sender identity and secret presented to the relay.
 */
public record Credentials(String identity, String secret) {

    public Credentials {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(secret, "secret must not be null");
    }

    @Override
    public String toString() {
        return "Credentials[identity=" + identity + ", secret=****]";
    }
}
