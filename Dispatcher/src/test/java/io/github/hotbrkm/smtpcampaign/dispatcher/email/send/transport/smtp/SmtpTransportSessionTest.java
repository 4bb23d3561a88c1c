package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.OutboundMessage;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.Credentials;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.RelayEndpoint;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSendException;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSetupException;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.TransportSetupException.Stage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayName("SmtpTransportSession test against a scripted relay")
class SmtpTransportSessionTest {

    private static final Credentials CREDENTIALS = new Credentials("sender@example.com", "s3cret");
    private static final SmtpTransportOptions OPTIONS =
            new SmtpTransportOptions("client.test", 2_000, 2_000, 2_000, List.of(), true);

    private ScriptedSmtpRelay relay;
    private SmtpTransportSession session;

    @AfterEach
    void tearDown() throws Exception {
        if (session != null) {
            session.close();
        }
        if (relay != null) {
            relay.close();
        }
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("AUTH PLAIN is used when offered, with the identity and secret in the initial response")
        void openShouldAuthenticateWithPlain() throws Exception {
            relay = ScriptedSmtpRelay.builder().start();
            session = new SmtpTransportSession(OPTIONS);

            session.open(plainEndpoint(), CREDENTIALS);

            assertThat(session.isOpen()).isTrue();
            List<String> commands = relay.commands();
            assertThat(commands.get(0)).isEqualTo("EHLO client.test");
            assertThat(commands.get(1)).startsWith("AUTH PLAIN ");
            String token = commands.get(1).substring("AUTH PLAIN ".length());
            assertThat(new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8))
                    .isEqualTo("\0sender@example.com\0s3cret");
        }

        @Test
        @DisplayName("AUTH LOGIN is used when it is the only mechanism offered")
        void openShouldFallBackToLogin() throws Exception {
            relay = ScriptedSmtpRelay.builder().extensions("SIZE 1000", "AUTH LOGIN").start();
            session = new SmtpTransportSession(OPTIONS);

            session.open(plainEndpoint(), CREDENTIALS);

            assertThat(session.isOpen()).isTrue();
            assertThat(relay.commands()).containsSubsequence(
                    "AUTH LOGIN",
                    base64("sender@example.com"),
                    base64("s3cret"));
        }

        @Test
        @DisplayName("A rejected credential fails at AUTH with the relay's status code")
        void openShouldFailOnBadCredential() throws Exception {
            relay = ScriptedSmtpRelay.builder().credentials("sender@example.com", "other").start();
            session = new SmtpTransportSession(OPTIONS);

            TransportSetupException exception = openFailure(plainEndpoint());

            assertThat(exception.getStage()).isEqualTo(Stage.AUTH);
            assertThat(exception.getStatusCode()).isEqualTo(535);
            assertThat(session.isOpen()).isFalse();
        }

        @Test
        @DisplayName("A relay offering no usable AUTH mechanism fails at AUTH")
        void openShouldFailWithoutAuthMechanism() throws Exception {
            relay = ScriptedSmtpRelay.builder().extensions("SIZE 1000", "AUTH XOAUTH2").start();
            session = new SmtpTransportSession(OPTIONS);

            TransportSetupException exception = openFailure(plainEndpoint());

            assertThat(exception.getStage()).isEqualTo(Stage.AUTH);
            assertThat(exception.getStatusCode()).isEqualTo(SmtpStatus.NOT_SUPPORTED);
        }

        @Test
        @DisplayName("STARTTLS required but not advertised fails without a plaintext fallback")
        void openShouldFailWhenStartTlsIsNotAdvertised() throws Exception {
            relay = ScriptedSmtpRelay.builder().start();
            session = new SmtpTransportSession(OPTIONS);

            TransportSetupException exception = openFailure(startTlsEndpoint());

            assertThat(exception.getStage()).isEqualTo(Stage.STARTTLS);
            assertThat(exception.getStatusCode()).isEqualTo(SmtpStatus.NOT_SUPPORTED);
            assertThat(relay.commands()).noneMatch(command -> command.startsWith("AUTH"));
            assertThat(relay.commands()).doesNotContain("STARTTLS");
        }

        @Test
        @DisplayName("A failed TLS handshake fails at STARTTLS before any credential is sent")
        void openShouldFailWhenHandshakeFails() throws Exception {
            relay = ScriptedSmtpRelay.builder().extensions("STARTTLS", "AUTH PLAIN").start();
            session = new SmtpTransportSession(OPTIONS);

            TransportSetupException exception = openFailure(startTlsEndpoint());

            assertThat(exception.getStage()).isEqualTo(Stage.STARTTLS);
            assertThat(exception.getStatusCode()).isEqualTo(SmtpStatus.TLS_FAILED);
            assertThat(relay.commands()).contains("STARTTLS");
            assertThat(relay.commands()).noneMatch(command -> command.startsWith("AUTH"));
        }

        @Test
        @DisplayName("A refused greeting fails at GREETING")
        void openShouldFailOnRejectedGreeting() throws Exception {
            relay = ScriptedSmtpRelay.builder().greeting("554 5.3.2 service unavailable").start();
            session = new SmtpTransportSession(OPTIONS);

            TransportSetupException exception = openFailure(plainEndpoint());

            assertThat(exception.getStage()).isEqualTo(Stage.GREETING);
            assertThat(exception.getStatusCode()).isEqualTo(554);
        }

        @Test
        @DisplayName("An unreachable relay fails at CONNECT")
        void openShouldFailWhenRelayIsUnreachable() throws Exception {
            session = new SmtpTransportSession(OPTIONS);
            RelayEndpoint endpoint = new RelayEndpoint(ScriptedSmtpRelay.HOST, ScriptedSmtpRelay.unusedPort(), false);

            TransportSetupException exception = openFailure(endpoint);

            assertThat(exception.getStage()).isEqualTo(Stage.CONNECT);
            assertThat(exception.getStatusCode()).isEqualTo(SmtpStatus.CONNECT_FAILED);
        }

        @Test
        @DisplayName("A session is opened only once")
        void openShouldRejectSecondOpen() throws Exception {
            relay = ScriptedSmtpRelay.builder().start();
            session = new SmtpTransportSession(OPTIONS);
            session.open(plainEndpoint(), CREDENTIALS);

            assertThatThrownBy(() -> session.open(plainEndpoint(), CREDENTIALS))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("A message is delivered with MAIL FROM, RCPT TO and DATA, and leading dots are stuffed")
        void sendShouldDeliverDotStuffedMessage() throws Exception {
            // given
            relay = ScriptedSmtpRelay.builder().start();
            session = new SmtpTransportSession(OPTIONS);
            session.open(plainEndpoint(), CREDENTIALS);
            String mime = "Subject: test\r\n\r\nline one\r\n.hidden\r\n";

            // when
            session.send(message("a@x.com", mime));

            // then
            assertThat(relay.commands()).containsSubsequence(
                    "MAIL FROM:<sender@example.com>",
                    "RCPT TO:<a@x.com>",
                    "DATA");
            assertThat(relay.messages()).containsExactly("Subject: test\r\n\r\nline one\r\n.hidden");
            assertThat(relay.rawMessages().get(0)).contains("\r\n..hidden");
        }

        @Test
        @DisplayName("A rejected recipient raises TransportSendException, resets the transaction and keeps the session usable")
        void sendShouldResetAfterRejectedRecipient() throws Exception {
            relay = ScriptedSmtpRelay.builder().rejectRecipient("gone@x.com").start();
            session = new SmtpTransportSession(OPTIONS);
            session.open(plainEndpoint(), CREDENTIALS);

            Throwable thrown = catchThrowable(() -> session.send(message("gone@x.com", "Subject: a\r\n\r\nbody\r\n")));

            assertThat(thrown).isInstanceOf(TransportSendException.class);
            TransportSendException exception = (TransportSendException) thrown;

            assertThat(exception.getStatusCode()).isEqualTo(550);
            assertThat(exception.getStep()).isEqualTo(SmtpCommand.RCPT_TO.getCommand());
            assertThat(relay.commands()).containsSubsequence("RCPT TO:<gone@x.com>", "RSET");

            session.send(message("b@y.com", "Subject: b\r\n\r\nbody\r\n"));
            assertThat(relay.messages()).containsExactly("Subject: b\r\n\r\nbody");
        }

        @Test
        @DisplayName("A timed out end-of-data reply drops the connection and later sends fail without touching the relay")
        void sendShouldDropConnectionAfterReplyTimeout() throws Exception {
            // given
            relay = ScriptedSmtpRelay.builder().delayDataReply(Duration.ofMillis(1_200)).start();
            session = new SmtpTransportSession(new SmtpTransportOptions("client.test", 2_000, 2_000, 300, List.of(), true));
            session.open(plainEndpoint(), CREDENTIALS);

            // when
            Throwable first = catchThrowable(() -> session.send(message("a@x.com", "Subject: one\r\n\r\nbody-one\r\n")));
            Throwable second = catchThrowable(() -> session.send(message("a@x.com", "Subject: one\r\n\r\nbody-one\r\n")));
            Throwable third = catchThrowable(() -> session.send(message("b@y.com", "Subject: two\r\n\r\nbody-two\r\n")));

            // then
            assertThat(first).isInstanceOf(TransportSendException.class);
            assertThat(((TransportSendException) first).getStatusCode()).isEqualTo(SmtpStatus.TIMEOUT);
            assertThat(((TransportSendException) first).getStep()).isEqualTo(SmtpCommand.DATA_END.getCommand());

            for (Throwable later : List.of(second, third)) {
                assertThat(later).isInstanceOf(TransportSendException.class);
                assertThat(((TransportSendException) later).getStatusCode()).isEqualTo(SmtpStatus.CONNECTION_ERROR);
            }

            assertThat(relay.messages()).containsExactly("Subject: one\r\n\r\nbody-one");
            assertThat(relay.commands()).doesNotContain("RSET");
            assertThat(relay.commands()).filteredOn(command -> command.startsWith("MAIL FROM:")).hasSize(1);
        }

        @Test
        @DisplayName("A rejected transaction on a healthy connection keeps the session valid for the next recipient")
        void sendShouldKeepSessionAfterRelayRejection() throws Exception {
            relay = ScriptedSmtpRelay.builder().rejectRecipient("gone@x.com").start();
            session = new SmtpTransportSession(OPTIONS);
            session.open(plainEndpoint(), CREDENTIALS);

            catchThrowable(() -> session.send(message("gone@x.com", "Subject: a\r\n\r\nbody\r\n")));
            catchThrowable(() -> session.send(message("gone@x.com", "Subject: a\r\n\r\nbody\r\n")));
            session.send(message("b@y.com", "Subject: b\r\n\r\nbody\r\n"));

            assertThat(relay.commands()).filteredOn("RSET"::equals).hasSize(2);
            assertThat(relay.messages()).containsExactly("Subject: b\r\n\r\nbody");
        }

        @Test
        @DisplayName("Sending on a session that is not open is a programming error")
        void sendShouldRequireOpenSession() {
            session = new SmtpTransportSession(OPTIONS);

            assertThatThrownBy(() -> session.send(message("a@x.com", "Subject: a\r\n\r\nbody")))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("close")
    class Close {

        @Test
        @DisplayName("close sends QUIT once, later calls do nothing")
        void closeShouldQuitOnce() throws Exception {
            relay = ScriptedSmtpRelay.builder().start();
            session = new SmtpTransportSession(OPTIONS);
            session.open(plainEndpoint(), CREDENTIALS);

            session.close();
            session.close();

            assertThat(session.isOpen()).isFalse();
            assertThat(relay.commands()).filteredOn("QUIT"::equals).hasSize(1);
            assertThatThrownBy(() -> session.send(message("a@x.com", "Subject: a\r\n\r\nbody")))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("close on a session that was never opened is a no-op")
        void closeShouldBeNoOpWhenNeverOpened() {
            session = new SmtpTransportSession(OPTIONS);

            session.close();

            assertThat(session.isOpen()).isFalse();
        }
    }

    private TransportSetupException openFailure(RelayEndpoint endpoint) {
        Throwable thrown = catchThrowable(() -> session.open(endpoint, CREDENTIALS));
        assertThat(thrown).isInstanceOf(TransportSetupException.class);
        assertThat(session.isOpen()).isFalse();
        return (TransportSetupException) thrown;
    }

    private RelayEndpoint plainEndpoint() {
        return new RelayEndpoint(ScriptedSmtpRelay.HOST, relay.port(), false);
    }

    private RelayEndpoint startTlsEndpoint() {
        return new RelayEndpoint(ScriptedSmtpRelay.HOST, relay.port(), true);
    }

    private static OutboundMessage message(String recipient, String mime) {
        return new OutboundMessage("sender@example.com", RecipientAddress.of(recipient), "subject", "<p>body</p>", List.of(), mime);
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
