package com.flamingo.ai.deepresearch.service.delivery;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.ConfigurationException;
import com.flamingo.ai.deepresearch.exception.DeliveryFailedException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

/** Delivers the summary as a UTF-8 plain-text email over SMTP. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailDeliveryNotifier implements DeliveryNotifier {

  static final String DEFAULT_SENDER = "no-reply@example.com";

  private final JavaMailSender mailSender;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public boolean isEnabled() {
    return researchConfig.getEmail().isEnabled();
  }

  @Override
  public void verifyConfiguration() {
    String recipient = researchConfig.getEmail().getRecipient();
    if (recipient == null || recipient.isBlank()) {
      throw new ConfigurationException(
          "research.email.recipient", "Email recipient not configured");
    }
  }

  @Override
  @Timed(value = "research.delivery", description = "Time to send the research summary")
  public void deliver(String topic, String summary) {
    verifyConfiguration();
    ResearchConfig.Email email = researchConfig.getEmail();
    String recipient = email.getRecipient();
    String sender =
        email.getSmtpUsername() == null || email.getSmtpUsername().isBlank()
            ? DEFAULT_SENDER
            : email.getSmtpUsername();

    try {
      MimeMessage message = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(message, false, "UTF-8");
      helper.setSubject(subjectFor(topic));
      helper.setFrom(sender);
      helper.setTo(recipient);
      helper.setText(summary, false);
      mailSender.send(message);
    } catch (MessagingException | MailException e) {
      throw new DeliveryFailedException(
          recipient, "Failed to email research summary to " + recipient + ": " + e.getMessage(), e);
    }

    meterRegistry.counter("research.delivery.sent").increment();
    log.info("Research summary for '{}' emailed to {}", topic, recipient);
  }

  static String subjectFor(String topic) {
    return "Research Summary: " + topic;
  }
}
