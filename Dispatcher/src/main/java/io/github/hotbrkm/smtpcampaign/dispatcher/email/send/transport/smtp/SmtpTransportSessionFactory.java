package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSession;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSessionFactory;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class SmtpTransportSessionFactory implements TransportSessionFactory {

    private final SmtpTransportOptions options;

    @Override
    public TransportSession create() {
        return new SmtpTransportSession(options);
    }
}
