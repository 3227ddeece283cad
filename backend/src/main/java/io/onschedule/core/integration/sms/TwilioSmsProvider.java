package io.onschedule.core.integration.sms;

import com.twilio.exception.ApiException;
import com.twilio.exception.TwilioException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.onschedule.core.config.SmsProperties;
import io.onschedule.core.integration.email.SendResult;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Twilio adapter. Credentials and the sender number are required at construction. */
public class TwilioSmsProvider implements SmsProvider {

  private static final Logger log = LoggerFactory.getLogger(TwilioSmsProvider.class);

  private final TwilioRestClient client;
  private final PhoneNumber from;
  private final URI statusCallback;

  public TwilioSmsProvider(SmsProperties properties) {
    this(properties, buildClient(properties));
  }

  TwilioSmsProvider(SmsProperties properties, TwilioRestClient client) {
    if (properties.fromNumber() == null || properties.fromNumber().isBlank()) {
      throw new IllegalStateException("onschedule.sms.from-number must be set for Twilio");
    }
    this.client = client;
    this.from = new PhoneNumber(properties.fromNumber());
    this.statusCallback =
        properties.statusCallbackUrl() == null || properties.statusCallbackUrl().isBlank()
            ? null
            : URI.create(properties.statusCallbackUrl());
  }

  @Override
  public String providerId() {
    return "twilio";
  }

  @Override
  public SendResult send(SmsMessage message) {
    var creator = Message.creator(new PhoneNumber(message.to()), from, message.body());
    if (statusCallback != null) {
      creator.setStatusCallback(statusCallback);
    }
    try {
      Message sent = creator.create(client);
      log.debug(
          "Twilio SMS queued for {}, sid: {}", PhoneNumbers.mask(message.to()), sent.getSid());
      return new SendResult(true, sent.getSid(), null);
    } catch (ApiException e) {
      log.error(
          "Twilio rejected SMS to {}: {} {}",
          PhoneNumbers.mask(message.to()),
          e.getStatusCode(),
          e.getMessage());
      Integer status = e.getStatusCode();
      if (status != null && (status == 401 || status == 403)) {
        return SendResult.unauthorized(e.getMessage());
      }
      return new SendResult(false, null, e.getMessage());
    } catch (TwilioException e) {
      log.error("Failed to send SMS to {}: {}", PhoneNumbers.mask(message.to()), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }

  private static TwilioRestClient buildClient(SmsProperties properties) {
    if (properties.accountSid() == null
        || properties.accountSid().isBlank()
        || properties.authToken() == null
        || properties.authToken().isBlank()) {
      throw new IllegalStateException(
          "onschedule.sms.account-sid and onschedule.sms.auth-token must be set for Twilio");
    }
    return new TwilioRestClient.Builder(properties.accountSid(), properties.authToken()).build();
  }
}
