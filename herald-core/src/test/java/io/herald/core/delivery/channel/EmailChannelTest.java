package io.herald.core.delivery.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.herald.core.delivery.DeliveryMetadata;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.Recipient;
import io.herald.core.model.SmtpConfig;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class EmailChannelTest {
    private static final SmtpConfig SMTP = new SmtpConfig(
        "smtp.example.com",
        587,
        "mailer",
        "secret",
        "news@example.com",
        "Media Server",
        true
    );

    @Test
    void shouldSendMultipartMessageWithNewsletterHeaders() throws Exception {
        RecordingSender sender = new RecordingSender(null);
        EmailChannel channel = new EmailChannel(sender);

        DeliveryResult result = channel.send(params(Recipient.email("reader@example.com"), "<p>Hello</p>", "Hello"));

        assertThat(result.success()).isTrue();
        assertThat(sender.sent).hasSize(1);
        MimeMessage message = sender.sent.get(0);
        assertThat(message.getSubject()).isEqualTo("This week");
        assertThat(((InternetAddress) message.getFrom()[0]).getAddress()).isEqualTo("news@example.com");
        assertThat(((InternetAddress) message.getFrom()[0]).getPersonal()).isEqualTo("Media Server");
        assertThat(message.getRecipients(Message.RecipientType.TO)[0].toString()).isEqualTo("reader@example.com");
        assertThat(message.getHeader("X-Newsletter-ID")[0]).isEqualTo("d-1");
        assertThat(message.getHeader("List-Unsubscribe")[0]).isEqualTo("<https://media.example.com/unsubscribe>");

        MimeMultipart body = (MimeMultipart) message.getContent();
        assertThat(body.getContentType()).startsWith("multipart/alternative");
        assertThat(body.getCount()).isEqualTo(2);
        assertThat(body.getBodyPart(0).getContent()).isEqualTo("Hello");
        assertThat(body.getBodyPart(1).getContent()).isEqualTo("<p>Hello</p>");
    }

    @Test
    void shouldSendSinglePartWhenOnlyHtmlExists() throws Exception {
        RecordingSender sender = new RecordingSender(null);
        EmailChannel channel = new EmailChannel(sender);

        channel.send(params(Recipient.email("reader@example.com"), "<p>Only html</p>", ""));

        MimeMessage message = sender.sent.get(0);
        assertThat(message.getContentType()).startsWith("text/html");
        assertThat(message.getContent()).isEqualTo("<p>Only html</p>");
    }

    @Test
    void shouldRejectRecipientsThatAreNotEmailAddresses() {
        RecordingSender sender = new RecordingSender(null);
        EmailChannel channel = new EmailChannel(sender);

        DeliveryResult result = channel.send(params(Recipient.user("42"), "<p>x</p>", "x"));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.INVALID_RECIPIENT);
        assertThat(sender.sent).isEmpty();
    }

    @Test
    void shouldClassifyTransportFailures() throws Exception {
        Address bounced = new InternetAddress("ghost@example.com");
        EmailChannel rejecting = new EmailChannel(new RecordingSender(
            new SendFailedException("Invalid Addresses", null, new Address[0], new Address[0], new Address[] {bounced})
        ));
        EmailChannel unreachable = new EmailChannel(new RecordingSender(
            new MessagingException("Could not connect to SMTP host", new ConnectException("Connection refused"))
        ));
        EmailChannel unauthorized = new EmailChannel(new RecordingSender(
            new MessagingException("535 5.7.8 Authentication credentials invalid")
        ));

        Recipient recipient = Recipient.email("ghost@example.com");
        assertThat(rejecting.send(params(recipient, "<p>x</p>", "x")).errorCode()).isEqualTo(ErrorCode.RECIPIENT_NOT_FOUND);
        DeliveryResult connection = unreachable.send(params(recipient, "<p>x</p>", "x"));
        assertThat(connection.errorCode()).isEqualTo(ErrorCode.CONNECTION_FAILED);
        assertThat(connection.retryable()).isTrue();
        assertThat(connection.errorMessage()).contains("ConnectException");
        assertThat(unauthorized.send(params(recipient, "<p>x</p>", "x")).errorCode()).isEqualTo(ErrorCode.AUTH_FAILED);
    }

    @Test
    void shouldValidateSmtpSettings() {
        EmailChannel channel = new EmailChannel(new RecordingSender(null));

        assertThatThrownBy(() -> channel.validate(ChannelConfig.empty())).hasMessageContaining("smtp configuration");
        assertThatThrownBy(() -> channel.validate(ChannelConfig.ofSmtp(
            new SmtpConfig("", 25, null, null, "a@example.com", null, false)
        ))).hasMessageContaining("host");
        assertThatThrownBy(() -> channel.validate(ChannelConfig.ofSmtp(
            new SmtpConfig("smtp", 70_000, null, null, "a@example.com", null, false)
        ))).hasMessageContaining("port");
        assertThatThrownBy(() -> channel.validate(ChannelConfig.ofSmtp(
            new SmtpConfig("smtp", 25, null, null, "nobody", null, false)
        ))).hasMessageContaining("not a valid email");
    }

    private static SendParams params(Recipient recipient, String html, String text) {
        return new SendParams(
            "d-1",
            "s-1",
            recipient,
            "This week",
            html,
            text,
            ChannelConfig.ofSmtp(SMTP),
            new DeliveryMetadata("Weekly", "Media Server", "https://media.example.com/unsubscribe")
        );
    }

    private static final class RecordingSender implements MailSender {
        private final MessagingException failure;
        private final List<MimeMessage> sent = new ArrayList<>();

        RecordingSender(MessagingException failure) {
            this.failure = failure;
        }

        @Override
        public Session session(SmtpConfig smtp) {
            return Session.getInstance(new Properties());
        }

        @Override
        public void send(MimeMessage message, SmtpConfig smtp) throws MessagingException {
            if (failure != null) {
                throw failure;
            }
            sent.add(message);
        }
    }
}
