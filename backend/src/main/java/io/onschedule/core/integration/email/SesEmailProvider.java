package io.onschedule.core.integration.email;

import io.onschedule.core.config.EmailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.Body;
import software.amazon.awssdk.services.sesv2.model.Content;
import software.amazon.awssdk.services.sesv2.model.Destination;
import software.amazon.awssdk.services.sesv2.model.EmailContent;
import software.amazon.awssdk.services.sesv2.model.Message;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SesV2Exception;

/**
 * Amazon SES adapter. Used as the fallback provider: it only sends locally rendered content, so
 * {@link #sendTemplateEmail} keeps the refusing default.
 */
public class SesEmailProvider implements EmailProvider, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SesEmailProvider.class);

  private final SesV2Client sesClient;
  private final String fromAddress;
  private final String replyTo;

  public SesEmailProvider(EmailProperties properties) {
    this(properties, buildClient(properties));
  }

  SesEmailProvider(EmailProperties properties, SesV2Client sesClient) {
    if (properties.senderAddress() == null || properties.senderAddress().isBlank()) {
      throw new IllegalStateException("onschedule.email.sender-address must be set for SES");
    }
    this.sesClient = sesClient;
    this.fromAddress =
        properties.senderName() == null || properties.senderName().isBlank()
            ? properties.senderAddress()
            : properties.senderName() + " <" + properties.senderAddress() + ">";
    this.replyTo = properties.replyTo();
  }

  @Override
  public String providerId() {
    return "ses";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    var body = Body.builder();
    if (message.htmlBody() != null) {
      body.html(utf8(message.htmlBody()));
    }
    if (message.plainTextBody() != null) {
      body.text(utf8(message.plainTextBody()));
    }

    var request =
        SendEmailRequest.builder()
            .fromEmailAddress(fromAddress)
            .destination(Destination.builder().toAddresses(message.to()).build())
            .content(
                EmailContent.builder()
                    .simple(
                        Message.builder()
                            .subject(utf8(message.subject()))
                            .body(body.build())
                            .build())
                    .build());
    String effectiveReplyTo = message.replyTo() != null ? message.replyTo() : replyTo;
    if (effectiveReplyTo != null && !effectiveReplyTo.isBlank()) {
      request.replyToAddresses(effectiveReplyTo);
    }

    try {
      var response = sesClient.sendEmail(request.build());
      log.debug("SES email sent to {}, message id: {}", message.to(), response.messageId());
      return new SendResult(true, response.messageId(), null);
    } catch (SesV2Exception e) {
      log.error(
          "SES rejected email to {}: HTTP {} {}", message.to(), e.statusCode(), e.getMessage());
      if (e.statusCode() == 401 || e.statusCode() == 403) {
        return SendResult.unauthorized(e.getMessage());
      }
      return new SendResult(false, null, e.getMessage());
    } catch (SdkException e) {
      log.error("Failed to send SES email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }

  @Override
  public void close() {
    sesClient.close();
  }

  private static Content utf8(String data) {
    return Content.builder().data(data).charset("UTF-8").build();
  }

  private static SesV2Client buildClient(EmailProperties properties) {
    var ses = properties.ses();
    if (ses.region() == null || ses.region().isBlank()) {
      throw new IllegalStateException("onschedule.email.ses.region must be set for SES");
    }
    var builder =
        SesV2Client.builder()
            .region(Region.of(ses.region()))
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(properties.requestTimeout())
                    .build());
    if (ses.accessKeyId() != null && !ses.accessKeyId().isBlank()) {
      builder.credentialsProvider(
          StaticCredentialsProvider.create(
              AwsBasicCredentials.create(ses.accessKeyId(), ses.secretAccessKey())));
    } else {
      builder.credentialsProvider(DefaultCredentialsProvider.create());
    }
    return builder.build();
  }
}
