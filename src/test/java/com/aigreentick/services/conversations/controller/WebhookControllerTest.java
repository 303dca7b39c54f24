package com.aigreentick.services.conversations.controller;

import com.aigreentick.services.conversations.config.WhatsAppConfig;
import com.aigreentick.services.conversations.exception.GlobalExceptionHandler;
import com.aigreentick.services.conversations.service.TenantCredentialResolver;
import com.aigreentick.services.conversations.service.TenantCredentials;
import com.aigreentick.services.conversations.service.WebhookService;
import com.aigreentick.services.conversations.service.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookController Tests")
class WebhookControllerTest {

    private static final String URL = "/api/v1/webhooks/whatsapp";
    private static final String SECRET = "platform-secret";
    private static final String PAYLOAD = """
            {"object":"whatsapp_business_account","entry":[{"id":"WABA","changes":[{"field":"messages",
             "value":{"metadata":{"phone_number_id":"PN-1"},
               "messages":[{"from":"9198","id":"wamid.A","type":"text","text":{"body":"hi"}}]}}]}]}
            """;

    @Mock private WebhookService webhookService;
    @Mock private TenantCredentialResolver credentialResolver;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        WhatsAppConfig config = new WhatsAppConfig();
        config.setAppSecret(SECRET);
        config.setWebhookVerifyToken("verify-me");
        lenient().when(credentialResolver.resolveByPhoneNumberId(any())).thenReturn(Optional.empty());

        WebhookController controller = new WebhookController(webhookService,
                new WebhookSignatureVerifier(config, credentialResolver), config, new ObjectMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET handshake echoes the challenge")
    void handshakeEchoesChallenge() throws Exception {
        mockMvc.perform(get(URL)
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "verify-me")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isOk())
                .andExpect(content().string("1158201444"));
    }

    @Test
    @DisplayName("GET handshake with a wrong token is forbidden")
    void handshakeWrongToken() throws Exception {
        mockMvc.perform(get(URL)
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "guess")
                        .param("hub.challenge", "42"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("GET handshake with a wrong mode is a bad request")
    void handshakeWrongMode() throws Exception {
        mockMvc.perform(get(URL)
                        .param("mode", "unsubscribe")
                        .param("verify_token", "verify-me")
                        .param("challenge", "42"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Signed delivery is accepted and handed off")
    void signedDeliveryAccepted() throws Exception {
        mockMvc.perform(post(URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", sign(PAYLOAD, SECRET))
                        .content(PAYLOAD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));

        verify(webhookService).processWebhookAsync(anyMap());
    }

    @Test
    @DisplayName("Delivery signed with another secret is rejected")
    void wrongSignatureRejected() throws Exception {
        mockMvc.perform(post(URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", sign(PAYLOAD, "someone-else"))
                        .content(PAYLOAD))
                .andExpect(status().isUnauthorized());

        verify(webhookService, never()).processWebhookAsync(anyMap());
    }

    @Test
    @DisplayName("Unsigned delivery is rejected")
    void unsignedDeliveryRejected() throws Exception {
        mockMvc.perform(post(URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYLOAD))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Signed delivery for another object type is acknowledged and ignored")
    void otherObjectIgnored() throws Exception {
        String body = "{\"object\":\"page\",\"entry\":[]}";

        mockMvc.perform(post(URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", sign(body, SECRET))
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ignored"));

        verify(webhookService, never()).processWebhookAsync(anyMap());
    }

    @Test
    @DisplayName("Delivery carrying another tenant's number under the first tenant's signature is rejected")
    void crossTenantDeliveryRejected() throws Exception {
        when(credentialResolver.resolveByPhoneNumberId("PN-X")).thenReturn(Optional.of(
                TenantCredentials.builder().organizationId(10L).phoneNumberId("PN-X")
                        .accessToken("token").appSecret("x-secret").build()));
        when(credentialResolver.resolveByPhoneNumberId("PN-Y")).thenReturn(Optional.of(
                TenantCredentials.builder().organizationId(20L).phoneNumberId("PN-Y")
                        .accessToken("token").appSecret("y-secret").build()));
        String body = """
                {"object":"whatsapp_business_account","entry":[
                  {"id":"WABA-X","changes":[{"field":"messages","value":{"metadata":{"phone_number_id":"PN-X"},
                    "messages":[{"from":"9198","id":"wamid.X","type":"text","text":{"body":"hi"}}]}}]},
                  {"id":"WABA-Y","changes":[{"field":"messages","value":{"metadata":{"phone_number_id":"PN-Y"},
                    "messages":[{"from":"9199","id":"wamid.Y","type":"text","text":{"body":"forged"}}]}}]}]}
                """;

        mockMvc.perform(post(URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Hub-Signature-256", sign(body, "x-secret"))
                        .content(body))
                .andExpect(status().isUnauthorized());

        verify(webhookService, never()).processWebhookAsync(anyMap());
    }

    private static String sign(String body, String secret) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return "sha256=" + HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }
}
