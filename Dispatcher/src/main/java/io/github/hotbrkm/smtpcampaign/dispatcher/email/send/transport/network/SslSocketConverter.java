package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.network;

import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.Socket;
import java.util.List;

public class SslSocketConverter {

    private static final String ENDPOINT_IDENTIFICATION = "HTTPS";

    private final SSLSocketFactory sslSocketFactory;

    public SslSocketConverter() {
        this((SSLSocketFactory) SSLSocketFactory.getDefault());
    }

    public SslSocketConverter(SSLSocketFactory sslSocketFactory) {
        this.sslSocketFactory = sslSocketFactory;
    }

    /**
     * Layers TLS over an already connected socket (STARTTLS) and runs the handshake.
     * The relay certificate must match {@code host}.
     *
     * @throws IOException when the handshake fails; the socket is no longer usable afterwards
     */
    public SSLSocket upgradeToSslSocket(Socket socket, String host, List<String> enabledTlsProtocols) throws IOException {
        SSLSocket sslSocket = (SSLSocket) sslSocketFactory.createSocket(socket, host, socket.getPort(), true);

        if (enabledTlsProtocols != null && !enabledTlsProtocols.isEmpty()) {
            sslSocket.setEnabledProtocols(enabledTlsProtocols.toArray(new String[0]));
        }

        SSLParameters sslParameters = sslSocket.getSSLParameters();
        sslParameters.setEndpointIdentificationAlgorithm(ENDPOINT_IDENTIFICATION);
        sslSocket.setSSLParameters(sslParameters);

        sslSocket.setUseClientMode(true);
        sslSocket.startHandshake();
        return sslSocket;
    }
}
