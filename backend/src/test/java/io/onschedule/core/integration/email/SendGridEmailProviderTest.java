package io.onschedule.core.integration.email;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import io.onschedule.core.config.EmailProperties;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SendGridEmailProviderTest {

  private SendGrid mockSendGrid;
  private Response mockResponse;
  private SendGridEmailProvider provider;
  private final ObjectMapper objectMapper = new ObjectMapper();

  @BeforeEach
  void setUp() throws IOException {
    mockSendGrid = mock(SendGrid.class);
    mockResponse = mock(Response.class);

    when(mockResponse.getStatusCode()).thenReturn(202);
    when(mockResponse.getHeaders()).thenReturn(Map.of("X-Message-Id", "sg-msg-abc123"));
    when(mockSendGrid.api(any(Request.class))).thenReturn(mockResponse);

    provider = new SendGridEmailProvider(properties("SG.test-api-key"), apiKey -> mockSendGrid);
  }

  @Test
  void sends_rendered_email_with_sender_and_contents() throws IOException {
    var result =
        provider.sendEmail(
            new EmailMessage(
                "client@example.com",
                "Inspection Reminder - Acme",
                "<p>Due soon</p>",
                "Due soon",
                null,
                Map.of("category", "inspection-reminder")));

    ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
    verify(mockSendGrid).api(captor.capture());
    JsonNode json = objectMapper.readTree(captor.getValue().getBody());

    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).isEqualTo("sg-msg-abc123");
    assertThat(json.get("subject").asText()).isEqualTo("Inspection Reminder - Acme");
    assertThat(json.get("from").get("email").asText()).isEqualTo("noreply@onschedule.test");
    assertThat(json.get("reply_to").get("email").asText()).isEqualTo("office@onschedule.test");
    assertThat(json.get("personalizations").get(0).get("custom_args").get("category").asText())
        .isEqualTo("inspection-reminder");
    assertThat(json.get("content")).hasSize(2);
  }

  @Test
  void sends_dynamic_template_with_template_data() throws IOException {
    provider.sendTemplateEmail(
        new TemplateEmailMessage(
            "client@example.com",
            "d-template-1",
            Map.of("companyName", "Acme", "assetName", "Boiler 1"),
            null));

    ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
    verify(mockSendGrid).api(captor.capture());
    JsonNode json = objectMapper.readTree(captor.getValue().getBody());

    assertThat(json.get("template_id").asText()).isEqualTo("d-template-1");
    JsonNode data = json.get("personalizations").get(0).get("dynamic_template_data");
    assertThat(data.get("companyName").asText()).isEqualTo("Acme");
    assertThat(data.get("assetName").asText()).isEqualTo("Boiler 1");
  }

  @Test
  void retries_server_errors_then_succeeds() throws IOException {
    when(mockResponse.getStatusCode()).thenReturn(500, 202);
    when(mockResponse.getBody()).thenReturn("upstream unavailable");

    var result = provider.sendEmail(plainMessage());

    assertThat(result.success()).isTrue();
    verify(mockSendGrid, times(2)).api(any(Request.class));
  }

  @Test
  void gives_up_after_max_attempts() throws IOException {
    when(mockSendGrid.api(any(Request.class))).thenThrow(new IOException("Connection refused"));

    var result = provider.sendEmail(plainMessage());

    assertThat(result.success()).isFalse();
    assertThat(result.unauthorized()).isFalse();
    assertThat(result.errorMessage()).isEqualTo("Connection refused");
    verify(mockSendGrid, times(3)).api(any(Request.class));
  }

  @Test
  void reports_401_as_unauthorized_without_retrying() throws IOException {
    when(mockResponse.getStatusCode()).thenReturn(401);
    when(mockResponse.getBody()).thenReturn("{\"errors\":[{\"message\":\"Invalid API key\"}]}");

    var result = provider.sendEmail(plainMessage());

    assertThat(result.success()).isFalse();
    assertThat(result.unauthorized()).isTrue();
    assertThat(result.errorMessage()).contains("401");
    verify(mockSendGrid, times(1)).api(any(Request.class));
  }

  @Test
  void reports_sdk_forbidden_exception_as_unauthorized() throws IOException {
    when(mockSendGrid.api(any(Request.class)))
        .thenThrow(
            new IOException(
                "Request returned status Code 403Body:{\"errors\":[{\"message\":\"The from"
                    + " address does not match a verified Sender Identity\"}]}"));

    var result = provider.sendEmail(plainMessage());

    assertThat(result.unauthorized()).isTrue();
    verify(mockSendGrid, times(1)).api(any(Request.class));
  }

  @Test
  void does_not_retry_client_errors() throws IOException {
    when(mockResponse.getStatusCode()).thenReturn(400);
    when(mockResponse.getBody()).thenReturn("bad request");

    var result = provider.sendEmail(plainMessage());

    assertThat(result.success()).isFalse();
    assertThat(result.unauthorized()).isFalse();
    verify(mockSendGrid, times(1)).api(any(Request.class));
  }

  @Test
  void requires_api_key() {
    assertThatThrownBy(() -> new SendGridEmailProvider(properties(" "), apiKey -> mockSendGrid))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("api-key");
  }

  @Test
  void recognises_unauthorized_error_text() {
    assertThat(SendGridEmailProvider.isUnauthorized("HTTP 401 Unauthorized")).isTrue();
    assertThat(SendGridEmailProvider.isUnauthorized("Forbidden")).isTrue();
    assertThat(SendGridEmailProvider.isUnauthorized("Service Unavailable")).isFalse();
    assertThat(SendGridEmailProvider.isUnauthorized(null)).isFalse();
  }

  private static EmailMessage plainMessage() {
    return new EmailMessage("client@example.com", "Subject", null, "body", null, null);
  }

  private static EmailProperties properties(String apiKey) {
    return new EmailProperties(
        "sendgrid",
        "ses",
        "noreply@onschedule.test",
        "OnSchedule",
        "office@onschedule.test",
        50,
        3,
        Duration.ZERO,
        Duration.ofSeconds(5),
        new EmailProperties.SendGrid(apiKey),
        new EmailProperties.Ses("eu-west-1", null, null),
        new EmailProperties.RateLimit(1000, 1000, 100000));
  }
}
