package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum SmtpCommand {
    CONNECT("CONNECT", 250),
    INIT("INIT", 220),
    HELO("HELO", 250),
    EHLO("EHLO", 250),
    STARTTLS("STARTTLS", 220),
    AUTH_PLAIN("AUTH PLAIN", 235),
    AUTH_LOGIN("AUTH LOGIN", 334),
    AUTH_USERNAME("AUTH_USERNAME", 334),   // base64 user name line of AUTH LOGIN
    AUTH_PASSWORD("AUTH_PASSWORD", 235),   // base64 password line of AUTH LOGIN
    MAIL_FROM("MAIL FROM:", 250),
    RCPT_TO("RCPT TO:", 250),
    DATA("DATA", 354),
    DATA_END("DATA_END", 250),  // Response after message transmission (250)
    RSET("RSET", 250),
    QUIT("QUIT", 221);

    private final String command;
    private final int successCode;

    public String buildMessage(String message) {
        if (message == null || message.isEmpty()) {
            return command;
        }

        // MAIL FROM:, RCPT TO: already contain colon, so concatenate without space
        if (command.endsWith(":")) {
            return command + message;
        }

        return command + " " + message;
    }

    @Override
    public String toString() {
        return command;
    }
}
