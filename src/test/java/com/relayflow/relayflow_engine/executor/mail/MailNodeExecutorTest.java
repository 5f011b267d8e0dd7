package com.relayflow.relayflow_engine.executor.mail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayflow.relayflow_engine.config.EngineProperties;
import com.relayflow.relayflow_engine.executor.HttpFailureClassifier;
import com.relayflow.relayflow_engine.executor.NodeExecutionRequest;
import com.relayflow.relayflow_engine.executor.NodeResult;
import com.relayflow.relayflow_engine.executor.TemplateRenderer;
import com.relayflow.relayflow_engine.model.run.ErrorKind;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class MailNodeExecutorTest {

    private JavaMailSender sender;
    private MockRestServiceServer apiServer;
    private MailNodeExecutor executor;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        sender = Mockito.mock(JavaMailSender.class);
        Mockito.when(sender.createMimeMessage())
                .thenAnswer(invocation -> new MimeMessage(Session.getInstance(new Properties())));
        ObjectProvider<JavaMailSender> senderProvider = Mockito.mock(ObjectProvider.class);
        Mockito.when(senderProvider.getIfAvailable()).thenReturn(sender);

        RestTemplate restTemplate = new RestTemplate();
        apiServer = MockRestServiceServer.bindTo(restTemplate).build();

        EngineProperties properties = new EngineProperties();
        properties.getMail().setFrom("bot@example.com");
        properties.getMail().setApiUrl("https://mail.example.com/v1/send");
        properties.getMail().setApiKey("key-1");

        MailProviderFactory providers = new MailProviderFactory(List.of(
                new SmtpMailProvider(senderProvider),
                new HttpApiMailProvider(restTemplate, new HttpFailureClassifier(Clock.systemUTC()), properties)));
        executor = new MailNodeExecutor(new TemplateRenderer(new ObjectMapper()), providers, properties);
    }

    @Test
    public void shouldRenderAndSendOverSmtp() throws Exception {
        NodeResult result = executor.execute(request(Map.of(
                "to", "ops@example.com, lead@example.com",
                "subject", "PR #{{pr.number}} merged",
                "body", "{{pr.title}} by {{pr.author}}")));

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        Mockito.verify(sender).send(sent.capture());
        Assertions.assertTrue(result.isSuccess(), result.getErrorMessage());
        Assertions.assertEquals("PR #12 merged", sent.getValue().getSubject());
        Assertions.assertEquals("bot@example.com", sent.getValue().getFrom()[0].toString());
        Assertions.assertEquals(2, sent.getValue().getRecipients(Message.RecipientType.TO).length);
        Assertions.assertEquals("Add retries by ada", sent.getValue().getContent());
        Assertions.assertEquals(List.of("ops@example.com", "lead@example.com"), result.getOutput().get("to"));
        Assertions.assertEquals("smtp", result.getOutput().get("provider"));
    }

    @Test
    public void shouldRetryTransientSmtpFailures() {
        Mockito.doThrow(new MailSendException("Connection refused")).when(sender).send(Mockito.any(MimeMessage.class));

        NodeResult result = executor.execute(request(Map.of("to", "ops@example.com", "subject", "hi", "body", "x")));

        Assertions.assertEquals(ErrorKind.RETRYABLE, result.getErrorKind());
    }

    @Test
    public void shouldNotRetryAuthenticationFailures() {
        Mockito.doThrow(new MailAuthenticationException("535 bad credentials")).when(sender).send(Mockito.any(MimeMessage.class));

        NodeResult result = executor.execute(request(Map.of("to", "ops@example.com", "subject", "hi", "body", "x")));

        Assertions.assertEquals(ErrorKind.FATAL, result.getErrorKind());
    }

    @Test
    public void shouldFailValidationOnRenderErrorsWithoutSending() {
        NodeResult result = executor.execute(request(Map.of(
                "to", "ops@example.com", "subject", "{{pr.reviewer}}", "body", "x")));

        Assertions.assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
        Mockito.verify(sender, Mockito.never()).send(Mockito.any(MimeMessage.class));
    }

    @Test
    public void shouldRejectEmptyRecipients() {
        NodeResult result = executor.execute(request(Map.of("to", List.of(), "subject", "hi", "body", "x")));

        Assertions.assertEquals(ErrorKind.VALIDATION, result.getErrorKind());
    }

    @Test
    public void shouldSendThroughMailApi() {
        apiServer.expect(requestTo("https://mail.example.com/v1/send"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer key-1"))
                .andExpect(content().json("{\"from\":\"bot@example.com\",\"to\":[\"ops@example.com\"],"
                        + "\"subject\":\"PR #12 merged\",\"html\":\"<b>Add retries</b>\"}"))
                .andRespond(withSuccess("{\"id\":\"msg-7\"}", MediaType.APPLICATION_JSON));

        NodeResult result = executor.execute(request(Map.of(
                "provider", "api", "to", "ops@example.com", "subject", "PR #{{pr.number}} merged",
                "body", "<b>{{pr.title}}</b>", "html", true)));

        apiServer.verify();
        Assertions.assertEquals("msg-7", result.getOutput().get("messageId"));
        Assertions.assertEquals("api", result.getOutput().get("provider"));
    }

    @Test
    public void shouldClassifyMailApiErrors() {
        apiServer.expect(requestTo("https://mail.example.com/v1/send"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        apiServer.expect(requestTo("https://mail.example.com/v1/send"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

        Map<String, Object> config = Map.of("provider", "api", "to", "ops@example.com", "subject", "hi", "body", "x");
        NodeResult unavailable = executor.execute(request(config));
        NodeResult rejected = executor.execute(request(config));

        Assertions.assertEquals(ErrorKind.RETRYABLE, unavailable.getErrorKind());
        Assertions.assertEquals(ErrorKind.FATAL, rejected.getErrorKind());
    }

    private static NodeExecutionRequest request(Map<String, Object> config) {
        return NodeExecutionRequest.builder()
                .runId("run-1")
                .nodeId("notify")
                .attempt(1)
                .config(config)
                .inputs(Map.of("pr", Map.of("number", 12, "title", "Add retries", "author", "ada")))
                .build();
    }
}
