package io.herald.core.delivery.channel;

import io.herald.core.model.SmtpConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import java.time.Duration;
import java.util.Properties;

public final class SmtpMailSender implements MailSender {
    private final Duration timeout;

    public SmtpMailSender(Duration timeout) {
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    }

    @Override
    public Session session(SmtpConfig smtp) {
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", smtp.host());
        props.put("mail.smtp.port", String.valueOf(smtp.port()));
        props.put("mail.smtp.auth", String.valueOf(hasCredentials(smtp)));
        props.put("mail.smtp.starttls.enable", String.valueOf(smtp.useTls()));
        props.put("mail.smtp.connectiontimeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(timeout.toMillis()));
        return Session.getInstance(props);
    }

    @Override
    public void send(MimeMessage message, SmtpConfig smtp) throws MessagingException {
        if (hasCredentials(smtp)) {
            Transport.send(message, smtp.username(), smtp.password());
        } else {
            Transport.send(message);
        }
    }

    private boolean hasCredentials(SmtpConfig smtp) {
        return smtp.username() != null && !smtp.username().isBlank();
    }
}
