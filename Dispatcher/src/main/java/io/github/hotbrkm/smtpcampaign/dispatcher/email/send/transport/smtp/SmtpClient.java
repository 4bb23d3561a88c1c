package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.Credentials;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSetupException;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSetupException.Stage;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.network.SocketConfig;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.network.SocketManager;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;

@Slf4j
public class SmtpClient {

    private static final String AUTH_PLAIN = "PLAIN";
    private static final String AUTH_LOGIN = "LOGIN";

    private final SocketManager socketManager;
    private final SmtpTlsConfig smtpTlsConfig;
    private final SmtpCommandHandler smtpCommandHandler;

    private final SmtpSession sessionInfo;

    private String helo;

    public SmtpClient(SocketConfig socketConfig, SmtpTlsConfig smtpTlsConfig) {
        this(socketConfig, smtpTlsConfig, false);
    }

    public SmtpClient(SocketConfig socketConfig, SmtpTlsConfig smtpTlsConfig, boolean traceLog) {
        this(new SocketManager(socketConfig), smtpTlsConfig, traceLog);
    }

    public SmtpClient(SocketManager socketManager, SmtpTlsConfig smtpTlsConfig, boolean traceLog) {
        this.sessionInfo = new SmtpSession();
        this.socketManager = socketManager;
        this.smtpTlsConfig = smtpTlsConfig;
        this.smtpCommandHandler = new SmtpCommandHandler(sessionInfo);
        this.smtpCommandHandler.setTraceLog(traceLog);
    }

    /**
     * <pre>
     * Opens an authenticated session:
     *   connect, 220 greeting, EHLO (HELO fallback),
     *   STARTTLS and EHLO again when configured,
     *   AUTH PLAIN, or AUTH LOGIN when the relay only offers LOGIN.
     * On failure the connection is closed before the exception is thrown.
     * </pre>
     *
     * @throws TransportSetupException naming the failed stage and the relay status
     */
    public SmtpSession openSession(String helo, Credentials credentials) {
        this.helo = helo;

        connect();

        SmtpCommandResponse greeting = smtpCommandHandler.readInitResponse();
        if (!greeting.isSuccess()) {
            throw fail(Stage.GREETING, greeting);
        }

        SmtpCommandResponse heloResponse = smtpCommandHandler.sendEhloOrHelo(helo);
        if (!heloResponse.isSuccess()) {
            throw fail(Stage.EHLO, heloResponse);
        }

        if (smtpTlsConfig.startTls()) {
            heloResponse = startTls(heloResponse);
        }

        authenticate(heloResponse, credentials);
        log.info("SMTP session opened. server={}, tls={}, identity={}",
                socketManager.getServerAddress(), sessionInfo.getSslSocket() != null, credentials.identity());
        return sessionInfo;
    }

    private void connect() {
        try {
            Socket socket = socketManager.createSocket();
            sessionInfo.changeSocket(socket);
        } catch (IOException e) {
            SmtpCommandResponse response = smtpCommandHandler.addResponse(SmtpCommand.CONNECT,
                    SmtpStatus.CONNECT_FAILED + " connect to " + socketManager.getServerAddress() + " " + e);
            throw fail(Stage.CONNECT, response, e);
        }
    }

    /**
     * Upgrades the plain socket and repeats EHLO over the encrypted channel.
     * A relay that does not advertise STARTTLS is refused; there is no plaintext fallback.
     */
    private SmtpCommandResponse startTls(SmtpCommandResponse heloResponse) {
        if (!heloResponse.supports(SmtpCommand.STARTTLS.getCommand())) {
            SmtpCommandResponse response = smtpCommandHandler.addResponse(SmtpCommand.STARTTLS,
                    SmtpStatus.NOT_SUPPORTED + " relay does not advertise STARTTLS");
            throw fail(Stage.STARTTLS, response);
        }

        SmtpCommandResponse tlsResponse = smtpCommandHandler.sendStartTls();
        if (!tlsResponse.isSuccess()) {
            throw fail(Stage.STARTTLS, tlsResponse);
        }

        try {
            SSLSocket sslSocket = socketManager.upgradeToSslSocket(smtpTlsConfig.enabledTlsProtocols());
            sessionInfo.setSslSocket(sslSocket);
        } catch (IOException e) {
            SmtpCommandResponse response = smtpCommandHandler.addResponse(SmtpCommand.STARTTLS,
                    SmtpStatus.TLS_FAILED + " TLS handshake with " + socketManager.getServerAddress() + " failed " + e);
            throw fail(Stage.STARTTLS, response, e);
        }

        SmtpCommandResponse secureHelo = smtpCommandHandler.sendEhlo(helo);
        if (!secureHelo.isSuccess()) {
            throw fail(Stage.EHLO, secureHelo);
        }
        return secureHelo;
    }

    private void authenticate(SmtpCommandResponse heloResponse, Credentials credentials) {
        List<String> mechanisms = heloResponse.getAuthMechanisms();

        SmtpCommandResponse authResponse;
        if (mechanisms.contains(AUTH_PLAIN)) {
            authResponse = smtpCommandHandler.sendAuthPlain(credentials.identity(), credentials.secret());
        } else if (mechanisms.contains(AUTH_LOGIN)) {
            authResponse = smtpCommandHandler.sendAuthLogin();
            if (authResponse.isSuccess()) {
                authResponse = smtpCommandHandler.sendAuthUsername(credentials.identity());
            }
            if (authResponse.isSuccess()) {
                authResponse = smtpCommandHandler.sendAuthPassword(credentials.secret());
            }
        } else {
            authResponse = smtpCommandHandler.addResponse(SmtpCommand.AUTH_PLAIN,
                    SmtpStatus.NOT_SUPPORTED + " relay offers no supported AUTH mechanism " + mechanisms);
        }

        if (!authResponse.isSuccess()) {
            throw fail(Stage.AUTH, authResponse);
        }
    }

    private TransportSetupException fail(Stage stage, SmtpCommandResponse response) {
        return fail(stage, response, null);
    }

    private TransportSetupException fail(Stage stage, SmtpCommandResponse response, Throwable cause) {
        log.warn("SMTP session setup failed. server={}, stage={}, response={}",
                socketManager.getServerAddress(), stage, response.getOriginalMessage());
        close();
        return cause == null
                ? new TransportSetupException(stage, response.getStatusCode(), response.getOriginalMessage())
                : new TransportSetupException(stage, response.getStatusCode(), response.getOriginalMessage(), cause);
    }

    public boolean isValidSession() {
        return smtpCommandHandler.isValidSession();
    }

    /**
     * A reply timed out or the connection failed; the stream is out of step with the relay.
     */
    public boolean isConnectionLost() {
        return smtpCommandHandler.isConnectionLost();
    }

    public String getServerAddress() {
        return socketManager.getServerAddress();
    }

    public void setReadTimeout(int timeoutMillis) throws SocketException {
        sessionInfo.setSoTimeout(timeoutMillis);
    }

    public SmtpCommandResponse sendMailFrom(String mailFrom) {
        return smtpCommandHandler.sendMailFrom(mailFrom);
    }

    public SmtpCommandResponse sendRcptTo(String rcptTo) {
        return smtpCommandHandler.sendRcptTo(rcptTo);
    }

    public SmtpCommandResponse sendData() {
        return smtpCommandHandler.sendData();
    }

    /**
     * Sends the email body and the terminating dot.
     *
     * @param message email body content
     * @return SMTP command response
     */
    public SmtpCommandResponse sendMessage(String message) {
        return smtpCommandHandler.sendMessage(message);
    }

    public SmtpCommandResponse sendRset() {
        return smtpCommandHandler.sendRset();
    }

    public SmtpCommandResponse sendQuit() {
        return smtpCommandHandler.sendQuit();
    }

    /**
     * Closes the streams and both sockets.
     */
    public void close() {
        sessionInfo.close();
        socketManager.close();
    }
}
