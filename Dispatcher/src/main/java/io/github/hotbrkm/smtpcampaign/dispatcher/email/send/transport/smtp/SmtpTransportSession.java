package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.OutboundMessage;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.Credentials;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.RelayEndpoint;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSendException;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSession;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.network.SocketConfig;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketException;
import java.util.Objects;

/**
 * {@link TransportSession} over one SMTP connection.
 */
@Slf4j
public class SmtpTransportSession implements TransportSession {

    private final SmtpTransportOptions options;

    private SmtpClient client;
    private boolean closed;

    public SmtpTransportSession(SmtpTransportOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    @Override
    public void open(RelayEndpoint endpoint, Credentials credentials) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        if (client != null || closed) {
            throw new IllegalStateException("SMTP session can be opened only once");
        }

        SocketConfig socketConfig = new SocketConfig(endpoint.host(), endpoint.port(),
                options.connectTimeoutMillis(), options.readTimeoutMillis());
        SmtpClient candidate = createClient(socketConfig, new SmtpTlsConfig(endpoint.useStartTls(), options.enabledTlsProtocols()));
        candidate.openSession(options.helo(), credentials);
        client = candidate;
    }

    SmtpClient createClient(SocketConfig socketConfig, SmtpTlsConfig tlsConfig) {
        return new SmtpClient(socketConfig, tlsConfig, options.trace());
    }

    /**
     * MAIL FROM, RCPT TO, DATA and the message body. A rejected transaction is reset with RSET.
     * Once a reply times out or the connection fails, the connection is dropped and every later
     * send fails with {@link SmtpStatus#CONNECTION_ERROR}.
     */
    @Override
    public void send(OutboundMessage message) throws TransportSendException {
        Objects.requireNonNull(message, "message must not be null");
        if (!isOpen()) {
            throw new IllegalStateException("SMTP session is not open");
        }
        if (!client.isValidSession()) {
            throw new TransportSendException(SmtpCommand.MAIL_FROM.getCommand(), SmtpStatus.CONNECTION_ERROR,
                    "SMTP session to " + client.getServerAddress() + " is no longer usable");
        }

        SmtpCommandResponse response = client.sendMailFrom(message.sender());
        if (!response.isSuccess()) {
            throw reject(response);
        }

        response = client.sendRcptTo(message.recipient().value());
        if (!response.isSuccess()) {
            throw reject(response);
        }

        response = client.sendData();
        if (!response.isSuccess()) {
            throw reject(response);
        }

        response = sendBody(message);
        if (!response.isSuccess()) {
            throw reject(response);
        }

        log.debug("Relay accepted message. recipient={}, response={}", message.recipient(), response.getOriginalMessage());
    }

    // The end-of-data reply may take longer than an ordinary command reply
    private SmtpCommandResponse sendBody(OutboundMessage message) throws TransportSendException {
        try {
            client.setReadTimeout(options.dataReadTimeoutMillis());
            SmtpCommandResponse response = client.sendMessage(message.mime());
            client.setReadTimeout(options.readTimeoutMillis());
            return response;
        } catch (SocketException e) {
            dropConnection(SmtpCommand.DATA_END.getCommand(), e.toString());
            throw new TransportSendException(SmtpCommand.DATA_END.getCommand(), SmtpStatus.CONNECTION_ERROR, e.toString(), e);
        }
    }

    private TransportSendException reject(SmtpCommandResponse response) {
        if (client.isConnectionLost()) {
            dropConnection(response.getCommand().getCommand(), response.getOriginalMessage());
        } else if (SmtpStatus.isRelayReply(response.getStatusCode()) && client.isValidSession()) {
            SmtpCommandResponse rset = client.sendRset();
            if (!rset.isSuccess()) {
                log.warn("RSET after rejected transaction failed. server={}, response={}",
                        client.getServerAddress(), rset.getOriginalMessage());
            }
        }
        return new TransportSendException(response.getCommand().getCommand(), response.getStatusCode(), response.getOriginalMessage());
    }

    private void dropConnection(String step, String reason) {
        log.warn("SMTP connection dropped. server={}, step={}, reason={}", client.getServerAddress(), step, reason);
        client.close();
    }

    @Override
    public boolean isOpen() {
        return client != null && !closed;
    }

    @Override
    public void close() {
        if (client == null || closed) {
            return;
        }
        closed = true;

        if (client.isValidSession()) {
            SmtpCommandResponse quit = client.sendQuit();
            if (!quit.isSuccess()) {
                log.debug("QUIT was not acknowledged. server={}, response={}", client.getServerAddress(), quit.getOriginalMessage());
            }
        }
        client.close();
        log.info("SMTP session closed. server={}", client.getServerAddress());
    }
}
