package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.config.EmailConfig;

import java.util.Objects;

/**
 * Reads {@code email.credentials.identity} and {@code email.credentials.secret}.
 */
public class ConfigCredentialsProvider implements CredentialsProvider {

    private final EmailConfig.Credentials config;

    public ConfigCredentialsProvider(EmailConfig.Credentials config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public Credentials getCredentials() {
        if (isBlank(config.getIdentity()) || isBlank(config.getSecret())) {
            throw new IllegalStateException("email.credentials.identity and email.credentials.secret must be set");
        }
        return new Credentials(config.getIdentity().trim(), config.getSecret());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
