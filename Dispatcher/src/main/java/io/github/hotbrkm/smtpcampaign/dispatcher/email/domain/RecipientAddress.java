package io.github.hotbrkm.smtpcampaign.dispatcher.email.domain;

/**
 * A destination address that has passed {@link EmailAddressUtil#isValid(String)}.
 */
public record RecipientAddress(String value) {

    public RecipientAddress {
        if (!EmailAddressUtil.isValid(value)) {
            throw new IllegalArgumentException("Invalid email address: " + value);
        }
    }

    public static RecipientAddress of(String value) {
        return new RecipientAddress(value);
    }

    public String domain() {
        return EmailAddressUtil.extractDomain(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
