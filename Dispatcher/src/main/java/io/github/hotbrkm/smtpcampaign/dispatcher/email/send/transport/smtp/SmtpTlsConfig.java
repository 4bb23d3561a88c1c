package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import java.util.List;

/**
 * @param startTls            upgrade the connection with STARTTLS before authenticating
 * @param enabledTlsProtocols protocols offered in the handshake
 */
public record SmtpTlsConfig(boolean startTls, List<String> enabledTlsProtocols) {

    public SmtpTlsConfig {
        enabledTlsProtocols = enabledTlsProtocols == null ? List.of() : List.copyOf(enabledTlsProtocols);
    }
}
