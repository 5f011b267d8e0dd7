package com.relayflow.relayflow_engine.executor.mail;

import com.relayflow.relayflow_engine.model.run.ErrorKind;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends through Spring's {@link JavaMailSender}, configured with the standard
 * {@code spring.mail.*} properties. Authentication and message errors are fatal; any other
 * send failure is treated as transient.
 */
@Slf4j
@Component
public class SmtpMailProvider implements MailProvider {

    private final ObjectProvider<JavaMailSender> mailSender;

    public SmtpMailProvider(ObjectProvider<JavaMailSender> mailSender) {
        this.mailSender = mailSender;
    }

    @Override
    public String getName() {
        return "smtp";
    }

    @Override
    public Map<String, Object> send(MailMessage message) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new MailDeliveryException(ErrorKind.FATAL, "SMTP is not configured; set spring.mail.host", (Throwable) null);
        }
        try {
            MimeMessage mime = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, StandardCharsets.UTF_8.name());
            if (message.from() != null) helper.setFrom(message.from());
            helper.setTo(message.to().toArray(String[]::new));
            if (!message.cc().isEmpty()) helper.setCc(message.cc().toArray(String[]::new));
            helper.setSubject(message.subject());
            helper.setText(message.body(), message.html());
            sender.send(mime);

            Map<String, Object> receipt = new LinkedHashMap<>();
            receipt.put("provider", getName());
            receipt.put("messageId", mime.getMessageID());
            return receipt;

        } catch (MessagingException ex) {
            throw new MailDeliveryException(ErrorKind.FATAL, "Invalid mail message: " + ex.getMessage(), ex);
        } catch (MailAuthenticationException ex) {
            throw new MailDeliveryException(ErrorKind.FATAL, "SMTP authentication failed: " + ex.getMessage(), ex);
        } catch (MailParseException | MailPreparationException ex) {
            throw new MailDeliveryException(ErrorKind.FATAL, "Invalid mail message: " + ex.getMessage(), ex);
        } catch (MailException ex) {
            log.warn("SMTP send failed, will be retried: {}", ex.getMessage());
            throw new MailDeliveryException(ErrorKind.RETRYABLE, "SMTP send failed: " + ex.getMessage(), ex);
        }
    }
}
