package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.entry;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.EmailAddressUtil;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.MessageBuilder;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient.RecipientExtraction;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient.RecipientExtractor;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.DispatchEngine;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.DispatchPolicy;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.Sleeper;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.metrics.DispatchMetrics;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.progress.ProgressSink;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result.RecipientOutcome;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.Credentials;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.CredentialsProvider;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.RelayEndpoint;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSession;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSessionFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Campaign runner.
 * <p>
 * Runs in order: extract recipients → open the relay session → dispatch → close the session.
 * Fatal errors ({@link io.github.hotbrkm.smtpcampaign.dispatcher.email.CampaignException}) are thrown to the
 * caller; the session is closed exactly once on every path after it was created.
 */
@Slf4j
public class CampaignRunner {

    private final RecipientExtractor recipientExtractor;
    private final CredentialsProvider credentialsProvider;
    private final TransportSessionFactory transportSessionFactory;
    private final RelayEndpoint relayEndpoint;
    private final DispatchPolicy dispatchPolicy;
    private final Sleeper sleeper;
    private final DispatchMetrics metrics;
    private final String defaultSender;

    public CampaignRunner(RecipientExtractor recipientExtractor, CredentialsProvider credentialsProvider,
                          TransportSessionFactory transportSessionFactory, RelayEndpoint relayEndpoint,
                          DispatchPolicy dispatchPolicy, Sleeper sleeper, DispatchMetrics metrics, String defaultSender) {
        this.recipientExtractor = Objects.requireNonNull(recipientExtractor, "recipientExtractor must not be null");
        this.credentialsProvider = Objects.requireNonNull(credentialsProvider, "credentialsProvider must not be null");
        this.transportSessionFactory = Objects.requireNonNull(transportSessionFactory, "transportSessionFactory must not be null");
        this.relayEndpoint = Objects.requireNonNull(relayEndpoint, "relayEndpoint must not be null");
        this.dispatchPolicy = Objects.requireNonNull(dispatchPolicy, "dispatchPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.metrics = metrics == null ? DispatchMetrics.standalone() : metrics;
        this.defaultSender = defaultSender == null || defaultSender.isBlank() ? null : defaultSender.trim();
    }

    /**
     * @return one outcome per valid recipient, in table order
     * @throws io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient.SchemaException when the table has no email column
     * @throws EmptyRecipientListException when no row holds a valid address
     * @throws IllegalArgumentException when the sender is not a valid address
     * @throws io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSetupException when the relay session cannot be opened
     */
    public List<RecipientOutcome> run(CampaignRequest request, ProgressSink progressSink) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(progressSink, "progressSink must not be null");

        // 1. Extract the work list
        RecipientExtraction extraction = recipientExtractor.extract(request.recipientTable());
        if (extraction.isEmpty()) {
            throw new EmptyRecipientListException("No valid email addresses found in column '"
                    + extraction.emailColumn() + "' (" + extraction.rejectedRows().size() + " rows rejected)");
        }
        progressSink.onInfo("Found " + extraction.recipients().size() + " valid email addresses");

        Credentials credentials = credentialsProvider.getCredentials();
        String sender = resolveSender(request, credentials);
        log.info("event=campaign_started, recipients={}, rejected={}, relay={}, sender={}, attachments={}",
                extraction.recipients().size(), extraction.rejectedRows().size(), relayEndpoint, sender,
                request.attachments().size());

        // 2. Open the session, 3. dispatch, 4. close
        TransportSession session = transportSessionFactory.create();
        try {
            session.open(relayEndpoint, credentials);

            MessageBuilder messageBuilder = new MessageBuilder(sender, request.subject(), request.htmlBody(), request.attachments());
            DispatchEngine engine = new DispatchEngine(messageBuilder, session, progressSink, dispatchPolicy, sleeper, metrics);
            return engine.run(extraction.recipients());
        } finally {
            session.close();
        }
    }

    /**
     * Request sender, then the configured sender, then the login identity.
     *
     * @throws IllegalArgumentException when the chosen sender is not a valid address
     */
    private String resolveSender(CampaignRequest request, Credentials credentials) {
        String sender;
        if (request.sender() != null) {
            sender = request.sender();
        } else {
            sender = defaultSender != null ? defaultSender : credentials.identity();
        }
        if (!EmailAddressUtil.isValid(sender)) {
            throw new IllegalArgumentException("Invalid sender address: " + sender);
        }
        return sender;
    }
}
