package fr.lapetina.llm.verifier.infrastructure.notification.channel;

import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.infrastructure.config.VerifierConfig;
import fr.lapetina.llm.verifier.infrastructure.notification.ChannelWeight;
import fr.lapetina.llm.verifier.infrastructure.notification.DeliveryException;
import fr.lapetina.llm.verifier.infrastructure.notification.Notification;
import fr.lapetina.llm.verifier.infrastructure.notification.NotificationChannel;
import jakarta.mail.Authenticator;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;

/**
 * SMTP channel built on Jakarta Mail.
 */
public class EmailChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(EmailChannel.class);

    public static final String NAME = "email";

    private static final String TRUE_VALUE = "true";

    private final Session session;
    private final String from;
    private final String to;

    public EmailChannel(VerifierConfig.EmailConfig config) {
        this.session = createSession(config);
        this.from = config.getFrom();
        this.to = config.getTo();
        log.info("Email channel configured: smtpHost={}, smtpPort={}, startTls={}",
                config.getSmtpHost(), config.getSmtpPort(), config.isStartTls());
    }

    static Session createSession(VerifierConfig.EmailConfig config) {
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", config.getSmtpHost());
        props.put("mail.smtp.port", String.valueOf(config.getSmtpPort()));
        props.put("mail.smtp.connectiontimeout", String.valueOf(config.getTimeoutMs()));
        props.put("mail.smtp.timeout", String.valueOf(config.getTimeoutMs()));
        props.put("mail.smtp.writetimeout", String.valueOf(config.getTimeoutMs()));
        if (config.isStartTls()) {
            props.put("mail.smtp.starttls.enable", TRUE_VALUE);
            props.put("mail.smtp.starttls.required", TRUE_VALUE);
        }

        String username = config.getUsername();
        if (username == null || username.isBlank()) {
            return Session.getInstance(props);
        }
        props.put("mail.smtp.auth", TRUE_VALUE);
        String password = config.getPassword();
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChannelWeight weight() {
        return ChannelWeight.HEAVY;
    }

    @Override
    public String recipient() {
        return to;
    }

    @Override
    public void deliver(Notification notification) throws DeliveryException {
        MimeMessage message;
        try {
            message = buildMessage(notification);
        } catch (AddressException e) {
            throw new DeliveryException(ErrorType.UNCLASSIFIED, "Invalid email address: " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw new DeliveryException(ErrorType.UNCLASSIFIED, "Failed to build email: " + e.getMessage(), e);
        }

        try {
            send(message);
        } catch (AuthenticationFailedException e) {
            throw new DeliveryException(ErrorType.UNAUTHORIZED, "SMTP authentication failed", e);
        } catch (SendFailedException e) {
            throw new DeliveryException(ErrorType.UNCLASSIFIED, "SMTP rejected recipients: " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw new DeliveryException(ErrorType.TRANSPORT_ERROR, "SMTP delivery failed: " + e.getMessage(), e);
        }
    }

    MimeMessage buildMessage(Notification notification) throws MessagingException {
        String recipient = notification.recipient() != null ? notification.recipient() : to;
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(recipient));
        message.setSubject(notification.title(), StandardCharsets.UTF_8.name());
        message.setText(notification.body(), StandardCharsets.UTF_8.name());
        message.setHeader("X-Priority", xPriority(notification));
        message.setSentDate(new Date());
        return message;
    }

    /**
     * Hands the message to the SMTP transport.
     */
    protected void send(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    private static String xPriority(Notification notification) {
        return switch (notification.priority()) {
            case CRITICAL, HIGH -> "1";
            case NORMAL -> "3";
            case LOW -> "5";
        };
    }
}
