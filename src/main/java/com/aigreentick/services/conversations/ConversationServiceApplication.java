package com.aigreentick.services.conversations;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * WhatsApp conversation service
 *
 * This microservice handles:
 * - Webhook intake (signature check, status receipts, template status updates)
 * - Flow routing of inbound messages through tenant-defined node graphs
 * - The 24-hour customer service window per contact
 * - Outbound dispatch with per-tenant rate limiting and retry
 *
 * @author AiGreenTick Team
 * @version 1.0.0
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "WABA Conversation Service API",
                version = "1.0.0",
                description = "Conversation flow engine for the AiGreenTick WhatsApp platform.",
                contact = @Contact(
                        name = "AiGreenTick Support",
                        email = "support@aigreentick.com"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8082", description = "Local Development"),
                @Server(url = "https://api.aigreentick.com", description = "Production")
        }
)
public class ConversationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConversationServiceApplication.class, args);
    }
}
