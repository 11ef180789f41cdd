package io.herald.core.delivery.channel;

import io.herald.core.model.SmtpConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;

public interface MailSender {

    Session session(SmtpConfig smtp);

    void send(MimeMessage message, SmtpConfig smtp) throws MessagingException;
}
