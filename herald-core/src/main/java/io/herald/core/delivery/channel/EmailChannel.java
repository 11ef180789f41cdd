package io.herald.core.delivery.channel;

import io.herald.core.delivery.ChannelContent;
import io.herald.core.delivery.DeliveryChannel;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorClassifier;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.SmtpConfig;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EmailChannel implements DeliveryChannel {
    private static final Logger LOG = LoggerFactory.getLogger(EmailChannel.class);
    public static final String NAME = "email";

    private final MailSender sender;

    public EmailChannel(MailSender sender) {
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsHtml() {
        return true;
    }

    @Override
    public int maxContentLength() {
        return 0;
    }

    @Override
    public void validate(ChannelConfig config) {
        SmtpConfig smtp = config == null ? null : config.smtp();
        if (smtp == null) {
            throw new IllegalArgumentException("smtp configuration is required");
        }
        if (smtp.host() == null || smtp.host().isBlank()) {
            throw new IllegalArgumentException("smtp host is required");
        }
        if (smtp.port() < 1 || smtp.port() > 65_535) {
            throw new IllegalArgumentException("smtp port must be between 1 and 65535");
        }
        if (smtp.from() == null || smtp.from().isBlank()) {
            throw new IllegalArgumentException("smtp from address is required");
        }
        if (!ChannelContent.isValidEmail(smtp.from())) {
            throw new IllegalArgumentException("smtp from address is not a valid email: " + smtp.from());
        }
    }

    @Override
    public DeliveryResult send(SendParams params) {
        try {
            validate(params.config());
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.INVALID_CONFIG, e.getMessage());
        }
        if (!ChannelContent.isValidEmail(params.recipient().target())) {
            return DeliveryResult.failure(
                NAME,
                params.recipient(),
                ErrorCode.INVALID_RECIPIENT,
                "not a valid email address: " + params.recipient().target()
            );
        }

        SmtpConfig smtp = params.config().smtp();
        MimeMessage message;
        try {
            message = buildMessage(sender.session(smtp), params);
        } catch (MessagingException | UnsupportedEncodingException e) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.INVALID_CONFIG, "failed to build message: " + e.getMessage());
        }

        try {
            sender.send(message, smtp);
            LOG.debug("Sent {} to {} via {}", params.deliveryId(), params.recipient().target(), smtp.host());
            return DeliveryResult.success(NAME, params.recipient());
        } catch (SendFailedException e) {
            if (e.getInvalidAddresses() != null && e.getInvalidAddresses().length > 0) {
                return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.RECIPIENT_NOT_FOUND, describe(e));
            }
            return classified(params, e);
        } catch (MessagingException e) {
            return classified(params, e);
        }
    }

    MimeMessage buildMessage(Session session, SendParams params) throws MessagingException, UnsupportedEncodingException {
        SmtpConfig smtp = params.config().smtp();
        MimeMessage message = new MimeMessage(session);
        if (smtp.fromName() != null && !smtp.fromName().isBlank()) {
            message.setFrom(new InternetAddress(smtp.from(), smtp.fromName(), StandardCharsets.UTF_8.name()));
        } else {
            message.setFrom(new InternetAddress(smtp.from()));
        }
        message.setRecipient(Message.RecipientType.TO, new InternetAddress(params.recipient().target()));
        message.setSubject(params.subject(), StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());
        if (!params.deliveryId().isBlank()) {
            message.setHeader("X-Newsletter-ID", params.deliveryId());
        }
        if (!params.metadata().unsubscribeUrl().isBlank()) {
            message.setHeader("List-Unsubscribe", "<" + params.metadata().unsubscribeUrl() + ">");
        }

        boolean hasHtml = !params.html().isBlank();
        boolean hasText = !params.text().isBlank();
        if (hasHtml && hasText) {
            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(params.text(), StandardCharsets.UTF_8.name());
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setContent(params.html(), "text/html; charset=UTF-8");
            alternative.addBodyPart(textPart);
            alternative.addBodyPart(htmlPart);
            message.setContent(alternative);
        } else if (hasHtml) {
            message.setContent(params.html(), "text/html; charset=UTF-8");
        } else {
            message.setText(params.text(), StandardCharsets.UTF_8.name());
        }
        message.saveChanges();
        return message;
    }

    private DeliveryResult classified(SendParams params, MessagingException e) {
        String description = describe(e);
        ErrorCode code = ErrorClassifier.fromMailMessage(description);
        return DeliveryResult.failure(NAME, params.recipient(), code, description);
    }

    // Jakarta Mail wraps socket errors; the useful wording is usually on the nested cause.
    private static String describe(Exception e) {
        StringBuilder text = new StringBuilder(String.valueOf(e.getMessage()));
        Throwable cause = e.getCause();
        int depth = 0;
        while (cause != null && depth++ < 3) {
            text.append(": ").append(cause.getClass().getSimpleName()).append(' ').append(cause.getMessage());
            cause = cause.getCause();
        }
        return text.toString();
    }
}
