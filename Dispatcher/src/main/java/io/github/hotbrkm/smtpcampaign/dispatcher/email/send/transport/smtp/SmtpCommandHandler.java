package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

import static io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp.SmtpCommand.*;

/**
 * Handler that transmits SMTP commands and tracks the state of the session from their replies.
 */
@Slf4j
public class SmtpCommandHandler {
    private static final String REDACTED = "****";

    private final SmtpSession session;

    private SmtpCommandResponse lastResponse;
    private boolean heloSucceeded;
    private boolean quitSent;
    private boolean connectionLost;

    @Setter
    private boolean traceLog = false;

    public SmtpCommandHandler(SmtpSession session) {
        this.session = session;
    }

    public SmtpCommandResponse readInitResponse() {
        return record(INIT, sendCommand(null));
    }

    public List<String> sendCommand(String command) {
        return sendCommand(command, command);
    }

    /**
     * @param command   line written to the relay
     * @param traceText what the trace log shows instead of the line
     */
    private List<String> sendCommand(String command, String traceText) {
        List<String> responseLines = new ArrayList<>();

        try {
            writeMessage(command, traceText);
            readAllMessages(responseLines);

            return responseLines;
        } catch (InterruptedIOException e) {
            responseLines.add(SmtpStatus.TIMEOUT + " SMTP " + e);
            return responseLines;
        } catch (IOException e) {
            responseLines.add(SmtpStatus.CONNECTION_ERROR + " SMTP " + e);
            return responseLines;
        }
    }

    private void writeMessage(String command, String traceText) throws IOException {
        if (command != null) {
            if (traceLog) {
                log.info("[Send Message]: {}", traceText);
            }
            session.writeMessage(command);
        }
    }

    private void readAllMessages(List<String> responseLines) throws IOException {
        String line;
        do {
            line = session.readLine();
            if (traceLog) {
                log.info("[Read Message]: {}", line);
            }

            if (line == null) {
                throw new IOException("null reply from server");
            }

            responseLines.add(line);
        } while ((line.length() > 3) && (line.charAt(3) == '-'));
    }

    public SmtpCommandResponse sendEhloOrHelo(String helo) {
        SmtpCommandResponse smtpCommandResponse = sendEhlo(helo);

        if (smtpCommandResponse.isSuccess() || !SmtpStatus.isRelayReply(smtpCommandResponse.getStatusCode())) {
            return smtpCommandResponse;
        } else {
            return sendHelo(helo);
        }
    }

    public SmtpCommandResponse sendEhlo(String helo) {
        return record(EHLO, sendCommand(EHLO.buildMessage(helo)));
    }

    public SmtpCommandResponse sendHelo(String helo) {
        return record(HELO, sendCommand(HELO.buildMessage(helo)));
    }

    public SmtpCommandResponse sendStartTls() {
        return record(STARTTLS, sendCommand(STARTTLS.getCommand()));
    }

    /**
     * AUTH PLAIN with the initial response: base64 of {@code \0identity\0secret}.
     */
    public SmtpCommandResponse sendAuthPlain(String identity, String secret) {
        String token = base64("\0" + identity + "\0" + secret);
        return record(AUTH_PLAIN, sendCommand(AUTH_PLAIN.buildMessage(token), AUTH_PLAIN.buildMessage(REDACTED)));
    }

    public SmtpCommandResponse sendAuthLogin() {
        return record(AUTH_LOGIN, sendCommand(AUTH_LOGIN.getCommand()));
    }

    public SmtpCommandResponse sendAuthUsername(String identity) {
        return record(AUTH_USERNAME, sendCommand(base64(identity), REDACTED));
    }

    public SmtpCommandResponse sendAuthPassword(String secret) {
        return record(AUTH_PASSWORD, sendCommand(base64(secret), REDACTED));
    }

    public SmtpCommandResponse sendMailFrom(String mailFrom) {
        return record(MAIL_FROM, sendCommand(MAIL_FROM.buildMessage("<" + mailFrom + ">")));
    }

    public SmtpCommandResponse sendRcptTo(String rcptTo) {
        return record(RCPT_TO, sendCommand(RCPT_TO.buildMessage("<" + rcptTo + ">")));
    }

    public SmtpCommandResponse sendData() {
        return record(DATA, sendCommand(DATA.getCommand()));
    }

    /**
     * Sends the mail body.
     * Must be called after receiving 354 response to DATA command.
     * Lines starting with a dot are stuffed, and the body is terminated with a lone dot.
     */
    public SmtpCommandResponse sendMessage(String message) {
        String body = dotStuff(message);
        String traceText = "<message body, " + body.length() + " chars>";
        return record(DATA_END, sendCommand(body + "\r\n.", traceText));
    }

    public SmtpCommandResponse sendRset() {
        return record(RSET, sendCommand(RSET.getCommand()));
    }

    public SmtpCommandResponse sendQuit() {
        return record(QUIT, sendCommand(QUIT.getCommand()));
    }

    /**
     * Normalizes line breaks to CRLF, doubles leading dots and drops one trailing line break.
     */
    static String dotStuff(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }

        String normalized = message.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.endsWith("\n")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }

        StringBuilder stuffed = new StringBuilder(normalized.length() + 64);
        String[] lines = normalized.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                stuffed.append("\r\n");
            }
            if (lines[i].startsWith(".")) {
                stuffed.append('.');
            }
            stuffed.append(lines[i]);
        }
        return stuffed.toString();
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    private SmtpCommandResponse record(SmtpCommand command, List<String> responseLines) {
        return track(new SmtpCommandResponse(command, responseLines));
    }

    /**
     * Records a locally produced response, such as a refused connect or a missing extension.
     */
    public SmtpCommandResponse addResponse(SmtpCommand smtpCommand, String message) {
        return track(new SmtpCommandResponse(smtpCommand, Collections.singletonList(message)));
    }

    private SmtpCommandResponse track(SmtpCommandResponse response) {
        SmtpCommand command = response.getCommand();
        if ((command == HELO || command == EHLO) && response.isSuccess()) {
            heloSucceeded = true;
        }
        if (command == QUIT) {
            quitSent = true;
        }
        int statusCode = response.getStatusCode();
        if (statusCode == SmtpStatus.CONNECTION_ERROR || statusCode == SmtpStatus.TIMEOUT) {
            // A late reply would be read as the answer to the next command
            connectionLost = true;
        }
        lastResponse = response;
        return response;
    }

    /**
     * The session is valid once the greeting was answered by a successful EHLO or HELO, no QUIT has
     * been sent, and no reply has timed out or failed to arrive since.
     *
     * @return true if commands can still be exchanged on this connection
     */
    public boolean isValidSession() {
        return lastResponse != null && session.isConnected() && heloSucceeded && !quitSent && !connectionLost;
    }

    public boolean isConnectionLost() {
        return connectionLost;
    }
}
