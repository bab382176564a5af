package com.flamingo.ai.deepresearch.config;

import java.util.Properties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/** SMTP transport built from the research.email settings. */
@Configuration
public class MailConfig {

  @Bean
  public JavaMailSender javaMailSender(ResearchConfig researchConfig) {
    ResearchConfig.Email email = researchConfig.getEmail();
    JavaMailSenderImpl sender = new JavaMailSenderImpl();
    sender.setHost(email.getSmtpServer());
    sender.setPort(email.getSmtpPort());
    sender.setDefaultEncoding("UTF-8");

    boolean authenticate = hasText(email.getSmtpUsername()) && hasText(email.getSmtpPassword());
    if (authenticate) {
      sender.setUsername(email.getSmtpUsername());
      sender.setPassword(email.getSmtpPassword());
    }

    Properties props = sender.getJavaMailProperties();
    props.put("mail.transport.protocol", "smtp");
    props.put("mail.smtp.starttls.enable", "true");
    props.put("mail.smtp.auth", String.valueOf(authenticate));
    return sender;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
