package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.network;

import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.List;

@Slf4j
public class SocketManager {

    private final SocketConfig config;
    private final SslSocketConverter sslSocketConverter;
    private Socket socket;

    public SocketManager(SocketConfig config) {
        this(config, new SslSocketConverter());
    }

    public SocketManager(SocketConfig config, SslSocketConverter sslSocketConverter) {
        this.config = config;
        this.sslSocketConverter = sslSocketConverter;
    }

    public Socket createSocket() throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(config.getHost(), config.getPort()), config.getConnectionTimeout());
            socket.setSoTimeout(config.getReadTimeout());
        } catch (IOException e) {
            closeQuietly(socket);
            throw e;
        }
        this.socket = socket;
        return socket;
    }

    /**
     * Wraps the connected plain socket in TLS and completes the handshake against the relay host name.
     */
    public SSLSocket upgradeToSslSocket(List<String> enabledTlsProtocols) throws IOException {
        if (socket == null) {
            throw new IOException("No connected socket to upgrade");
        }
        return sslSocketConverter.upgradeToSslSocket(socket, config.getHost(), enabledTlsProtocols);
    }

    public String getServerAddress() {
        return config.toString();
    }

    public void close() {
        closeQuietly(socket);
        socket = null;
    }

    private static void closeQuietly(Socket socket) {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Failed to close socket", e);
            }
        }
    }
}
