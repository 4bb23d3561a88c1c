package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.config.EmailConfig;

import java.util.Objects;

/**
 * Address of the mail relay and whether the channel must be upgraded with STARTTLS.
 */
public record RelayEndpoint(String host, int port, boolean useStartTls) {

    public RelayEndpoint {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static RelayEndpoint from(EmailConfig.Smtp smtp) {
        return new RelayEndpoint(smtp.getHost(), smtp.resolvePort(), smtp.isUseStartTls());
    }

    @Override
    public String toString() {
        return host + ":" + port + (useStartTls ? " (STARTTLS)" : "");
    }
}
