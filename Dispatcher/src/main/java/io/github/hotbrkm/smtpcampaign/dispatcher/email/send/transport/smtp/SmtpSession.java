package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;

/**
 * Network side of an SMTP session: the active socket and its line reader and writer.
 */
@Getter
@Slf4j
public class SmtpSession implements AutoCloseable {

    private Socket socket;
    private SSLSocket sslSocket;
    private BufferedReader reader;
    private Writer writer;

    /**
     * Read timeout of the socket currently carrying the session.
     */
    public void setSoTimeout(int timeout) throws SocketException {
        Socket active = activeSocket();
        if (active != null) {
            active.setSoTimeout(timeout);
        }
    }

    public boolean isConnected() {
        Socket active = activeSocket();
        return active != null && active.isConnected() && !active.isClosed();
    }

    public void writeMessage(String message) throws IOException {
        if (writer == null) {
            throw new IOException("SMTP session is not connected");
        }

        writer.write(message);
        writer.write("\r\n");
        writer.flush();
    }

    public String readLine() throws IOException {
        if (reader == null) {
            throw new IOException("SMTP session is not connected");
        }

        return reader.readLine();
    }

    public void changeSocket(Socket socket) throws IOException {
        close();
        this.socket = socket;
        changeStream(socket);
    }

    /**
     * Continues the session over the TLS socket layered on the current plain socket.
     */
    public void setSslSocket(SSLSocket sslSocket) throws IOException {
        this.sslSocket = sslSocket;
        changeStream(sslSocket);
    }

    private void changeStream(Socket socket) throws IOException {
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    }

    private Socket activeSocket() {
        return sslSocket != null ? sslSocket : socket;
    }

    @Override
    public void close() {
        closeQuietly(writer);
        closeQuietly(reader);
        closeQuietly(sslSocket);
        closeQuietly(socket);
        writer = null;
        reader = null;
        sslSocket = null;
        socket = null;
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.debug("Failed to close SMTP stream: {}", e.toString());
            }
        }
    }
}
