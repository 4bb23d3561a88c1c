package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.config.EmailConfig;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Client-side settings of an SMTP session. Timeouts are in milliseconds.
 */
@Slf4j
public record SmtpTransportOptions(String helo, int connectTimeoutMillis, int readTimeoutMillis,
                                   int dataReadTimeoutMillis, List<String> enabledTlsProtocols, boolean trace) {

    private static final String FALLBACK_HELO = "localhost";

    public SmtpTransportOptions {
        helo = helo == null || helo.isBlank() ? localHostName() : helo.trim();
        enabledTlsProtocols = enabledTlsProtocols == null ? List.of() : List.copyOf(enabledTlsProtocols);
    }

    public static SmtpTransportOptions from(EmailConfig.Smtp smtp) {
        return new SmtpTransportOptions(
                smtp.getHelo(),
                secondsToMillis(smtp.getConnectTimeout()),
                secondsToMillis(smtp.getReadTimeout()),
                secondsToMillis(smtp.getDataReadTimeout()),
                smtp.getTlsEnabledProtocols(),
                smtp.isTrace());
    }

    /**
     * Negative values become 0 (no timeout), values beyond the int range of milliseconds are capped.
     */
    static int secondsToMillis(int seconds) {
        long millis = Math.max(seconds, 0) * 1000L;
        return (int) Math.min(millis, Integer.MAX_VALUE);
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name is not resolvable, using {}: {}", FALLBACK_HELO, e.toString());
            return FALLBACK_HELO;
        }
    }
}
