package io.github.hotbrkm.smtpcampaign.dispatcher.email.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Data
@ConfigurationProperties(prefix = "email")
@Component
public class EmailConfig {

    private Smtp smtp = new Smtp();
    private Credentials credentials = new Credentials();
    private Send send = new Send();

    @Data
    public static class Smtp {
        public static final String DEFAULT_HOST = "smtp.gmail.com";
        public static final int DEFAULT_PORT = 587;

        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private boolean useStartTls = true;
        private String helo;
        private String from;

        private int connectTimeout = 30;
        private int readTimeout = 60;
        private int dataReadTimeout = 300;

        private List<String> tlsEnabledProtocols = List.of("TLSv1.2", "TLSv1.3");

        private boolean trace;

        public int resolvePort() {
            return port > 0 && port <= 65_535 ? port : DEFAULT_PORT;
        }
    }

    /**
     * Sender identity and secret for relay authentication. Not meant to be written in files;
     * bind them from the environment (EMAIL_CREDENTIALS_IDENTITY, EMAIL_CREDENTIALS_SECRET).
     */
    @Data
    public static class Credentials {
        private String identity;
        private String secret;

        @Override
        public String toString() {
            return "Credentials(identity=" + identity + ", secret=****)";
        }
    }

    @Data
    public static class Send {
        public static final int DEFAULT_MAX_ATTEMPTS = 3;
        public static final long DEFAULT_RETRY_DELAY_MS = 2_000L;
        public static final long DEFAULT_PACING_DELAY_MS = 1_000L;

        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private long pacingDelayMs = DEFAULT_PACING_DELAY_MS;

        private List<String> allowedAttachmentExtensions = List.of("jpg", "jpeg", "png", "pdf");

        public int resolveMaxAttempts() {
            return maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        }

        public long resolveRetryDelayMs() {
            return retryDelayMs >= 0 ? retryDelayMs : DEFAULT_RETRY_DELAY_MS;
        }

        public long resolvePacingDelayMs() {
            return pacingDelayMs >= 0 ? pacingDelayMs : DEFAULT_PACING_DELAY_MS;
        }

        public boolean isAllowedAttachmentExtension(String extension) {
            if (extension == null || allowedAttachmentExtensions == null || allowedAttachmentExtensions.isEmpty()) {
                return false;
            }
            String normalized = extension.toLowerCase(Locale.ROOT);
            return allowedAttachmentExtensions.stream()
                    .anyMatch(allowed -> allowed != null && allowed.trim().toLowerCase(Locale.ROOT).equals(normalized));
        }
    }

}
