package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.client.DispatchRetryExecutor;
import com.aigreentick.services.conversations.client.MessageSendResponse;
import com.aigreentick.services.conversations.client.WhatsAppMessagingClient;
import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.constants.MessageKind;
import com.aigreentick.services.conversations.constants.MessageStatus;
import com.aigreentick.services.conversations.constants.WindowStatus;
import com.aigreentick.services.conversations.dto.response.DispatchResult;
import com.aigreentick.services.conversations.entity.ConversationEvent.EventType;
import com.aigreentick.services.conversations.entity.MessageTemplate;
import com.aigreentick.services.conversations.entity.OutboundMessage;
import com.aigreentick.services.conversations.exception.DispatchFailedException;
import com.aigreentick.services.conversations.exception.TemplateNotApprovedException;
import com.aigreentick.services.conversations.exception.WindowExpiredException;
import com.aigreentick.services.conversations.exception.WindowUnknownException;
import com.aigreentick.services.conversations.flow.OutboundReply;
import com.aigreentick.services.conversations.repository.MessageTemplateRepository;
import com.aigreentick.services.conversations.repository.OutboundMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Sends messages to contacts.
 *
 * Free-form text and interactive messages need an open window. Templates need
 * Meta approval instead, and a delivered template re-opens the window.
 * Every send takes a slot from the tenant's rate budget before the provider
 * is called. Provider errors are retried; once retries run out the send is
 * reported as a failed DispatchResult and an alert is raised.
 *
 * No transaction spans the provider call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageDispatcher {

    private static final String ALERT_DISPATCH_FAILED = "DISPATCH_FAILED";

    private final ConversationWindowService windowService;
    private final MessageTemplateRepository templateRepository;
    private final TenantCredentialResolver credentialResolver;
    private final DispatchRateLimiter rateLimiter;
    private final DispatchRetryExecutor retryExecutor;
    private final WhatsAppMessagingClient messagingClient;
    private final OutboundMessageRepository outboundRepository;
    private final ConversationEventSink eventSink;
    private final AlertPublisher alertPublisher;
    private final Clock clock;

    /**
     * @throws WindowUnknownException when the contact never wrote in
     * @throws WindowExpiredException when the window has closed; a template is required
     * @throws com.aigreentick.services.conversations.exception.RateLimitedException when the budget is used up
     */
    public DispatchResult sendText(Long organizationId, String contactPhone, String text) {
        requireOpenWindow(organizationId, contactPhone);
        return dispatch(organizationId, contactPhone, MessageKind.TEXT, text, "sendText",
                channel -> messagingClient.sendText(channel, contactPhone, text));
    }

    public DispatchResult sendInteractive(Long organizationId, String contactPhone, String body, List<String> buttons) {
        requireOpenWindow(organizationId, contactPhone);
        return dispatch(organizationId, contactPhone, MessageKind.INTERACTIVE, body, "sendInteractive",
                channel -> messagingClient.sendInteractive(channel, contactPhone, body, buttons));
    }

    /**
     * @throws TemplateNotApprovedException when the template is unknown or not approved
     */
    public DispatchResult sendTemplate(Long organizationId, String contactPhone, String templateName,
                                       String language, List<Map<String, Object>> components) {
        MessageTemplate template = findTemplate(organizationId, templateName, language)
                .orElseThrow(() -> new TemplateNotApprovedException(templateName, "UNKNOWN"));
        if (!template.isApproved()) {
            throw new TemplateNotApprovedException(templateName, template.getStatus().name());
        }

        DispatchResult result = dispatch(organizationId, contactPhone, MessageKind.TEMPLATE, templateName,
                "sendTemplate", channel -> messagingClient.sendTemplate(
                        channel, contactPhone, template.getName(), template.getLanguage(), components));

        if (result.isSuccess()) {
            windowService.reset(organizationId, contactPhone);
        }
        return result;
    }

    /**
     * Sends a flow reply. Replies with up to three short button labels go out
     * as interactive button messages, anything else as text with the
     * options enumerated.
     */
    public DispatchResult sendReply(Long organizationId, String contactPhone, OutboundReply reply) {
        if (fitsInteractive(reply)) {
            return sendInteractive(organizationId, contactPhone, reply.getBody(), reply.getButtons());
        }
        return sendText(organizationId, contactPhone, reply.getText());
    }

    // ════════════════════════════════════════════════════════════
    // PRIVATE
    // ════════════════════════════════════════════════════════════

    private DispatchResult dispatch(Long organizationId, String contactPhone, MessageKind kind, String body,
                                    String operation, Function<TenantCredentials, MessageSendResponse> send) {
        Optional<TenantCredentials> channel = credentialResolver.resolveForOrganization(organizationId);
        if (channel.isEmpty()) {
            String error = "No active WhatsApp channel for organization " + organizationId;
            alertPublisher.publish(ALERT_DISPATCH_FAILED, organizationId, contactPhone, error);
            return DispatchResult.failed(error, LocalDateTime.now(clock));
        }

        OutboundMessage outbound = rateLimiter.reserve(organizationId, contactPhone, kind, body);

        try {
            MessageSendResponse response = retryExecutor.execute(operation, contactPhone,
                    () -> send.apply(channel.get()));

            LocalDateTime now = LocalDateTime.now(clock);
            outbound.setProviderMessageId(response.getMessageId());
            outbound.setStatus(MessageStatus.SENT);
            outbound.setUpdatedAt(now);
            outboundRepository.save(outbound);

            log.info("Message sent: org={}, contact={}, kind={}, wamid={}",
                    organizationId, contactPhone, kind, response.getMessageId());
            return DispatchResult.success(response.getMessageId(), now);

        } catch (DispatchFailedException ex) {
            LocalDateTime now = LocalDateTime.now(clock);
            outbound.setStatus(MessageStatus.FAILED);
            outbound.setErrorMessage(ex.getMessage());
            outbound.setUpdatedAt(now);
            outboundRepository.save(outbound);

            eventSink.record(EventType.DISPATCH_FAILED, organizationId, contactPhone, null, null, ex.getMessage());
            alertPublisher.publish(ALERT_DISPATCH_FAILED, organizationId, contactPhone, ex.getMessage());
            return DispatchResult.failed(ex.getMessage(), now);
        }
    }

    private void requireOpenWindow(Long organizationId, String contactPhone) {
        WindowStatus status = windowService.status(organizationId, contactPhone);
        if (status == WindowStatus.UNKNOWN) {
            throw new WindowUnknownException(organizationId, contactPhone);
        }
        if (!status.allowsFreeMessages()) {
            throw new WindowExpiredException(organizationId, contactPhone);
        }
    }

    private Optional<MessageTemplate> findTemplate(Long organizationId, String name, String language) {
        if (language != null) {
            Optional<MessageTemplate> exact =
                    templateRepository.findByOrganizationIdAndNameAndLanguage(organizationId, name, language);
            if (exact.isPresent()) {
                return exact;
            }
        }
        return templateRepository.findFirstByOrganizationIdAndName(organizationId, name);
    }

    private static boolean fitsInteractive(OutboundReply reply) {
        return reply.hasButtons()
                && reply.getBody() != null && !reply.getBody().isBlank()
                && reply.getButtons().size() <= ConversationConstants.MAX_INTERACTIVE_BUTTONS
                && reply.getButtons().stream().allMatch(b -> b.length() <= ConversationConstants.MAX_BUTTON_TITLE_LENGTH);
    }
}
