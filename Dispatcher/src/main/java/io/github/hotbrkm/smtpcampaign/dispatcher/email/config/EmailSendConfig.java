package io.github.hotbrkm.smtpcampaign.dispatcher.email.config;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.AttachmentReader;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient.RecipientExtractor;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.DispatchPolicy;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.Sleeper;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine.metrics.DispatchMetrics;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.entry.CampaignRunner;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.ConfigCredentialsProvider;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.CredentialsProvider;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.RelayEndpoint;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSessionFactory;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp.SmtpTransportOptions;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp.SmtpTransportSessionFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EmailSendConfig {

    @Bean
    public RecipientExtractor recipientExtractor() {
        return new RecipientExtractor();
    }

    @Bean
    public AttachmentReader attachmentReader(EmailConfig emailConfig) {
        return new AttachmentReader(emailConfig.getSend());
    }

    @Bean
    @ConditionalOnMissingBean(CredentialsProvider.class)
    public CredentialsProvider credentialsProvider(EmailConfig emailConfig) {
        return new ConfigCredentialsProvider(emailConfig.getCredentials());
    }

    @Bean
    @ConditionalOnMissingBean(TransportSessionFactory.class)
    public TransportSessionFactory transportSessionFactory(EmailConfig emailConfig) {
        return new SmtpTransportSessionFactory(SmtpTransportOptions.from(emailConfig.getSmtp()));
    }

    @Bean
    public DispatchMetrics dispatchMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DispatchMetrics(meterRegistry.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public CampaignRunner campaignRunner(EmailConfig emailConfig, RecipientExtractor recipientExtractor,
                                         CredentialsProvider credentialsProvider, TransportSessionFactory transportSessionFactory,
                                         Sleeper sleeper, DispatchMetrics dispatchMetrics) {
        return new CampaignRunner(recipientExtractor, credentialsProvider, transportSessionFactory,
                RelayEndpoint.from(emailConfig.getSmtp()), DispatchPolicy.from(emailConfig.getSend()),
                sleeper, dispatchMetrics, emailConfig.getSmtp().getFrom());
    }
}
