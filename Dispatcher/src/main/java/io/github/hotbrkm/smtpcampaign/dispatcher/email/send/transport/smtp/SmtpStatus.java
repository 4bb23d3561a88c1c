package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

/**
 * Local status codes the client records when no usable reply was read from the relay.
 */
public final class SmtpStatus {

    private SmtpStatus() {
    }

    /** Could not connect to the relay */
    public static final int CONNECT_FAILED = 602;
    /** Relay does not offer a required extension */
    public static final int NOT_SUPPORTED = 650;
    /** TLS handshake failed */
    public static final int TLS_FAILED = 660;
    /** Connection lost while talking to the relay */
    public static final int CONNECTION_ERROR = 703;
    /** Reply not received in time */
    public static final int TIMEOUT = 704;
    /** Reply line is not an SMTP reply */
    public static final int INVALID_RESPONSE = 888;

    /**
     * Codes below 600 come from the relay; the rest are recorded locally.
     */
    public static boolean isRelayReply(int statusCode) {
        return statusCode >= 200 && statusCode < 600;
    }
}
