package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.network;

import lombok.Getter;

/**
 * Relay address and socket timeouts (milliseconds).
 */
@Getter
public class SocketConfig {

    private final String host;
    private final int port;
    private final int connectionTimeout;
    private final int readTimeout;

    public SocketConfig(String host, int port, int connectionTimeout, int readTimeout) {
        this.host = host;
        this.port = port;
        this.connectionTimeout = connectionTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
