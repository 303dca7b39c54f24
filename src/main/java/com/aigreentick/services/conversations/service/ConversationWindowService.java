package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.config.ConversationProperties;
import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.constants.WindowStatus;
import com.aigreentick.services.conversations.entity.ConversationWindow;
import com.aigreentick.services.conversations.entity.MessageTemplate;
import com.aigreentick.services.conversations.exception.InvalidRequestException;
import com.aigreentick.services.conversations.repository.ConversationWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the 24-hour customer service window of each conversation.
 *
 * A contact message opens or re-opens the window; free-form messages are
 * allowed only while it is open. Status is always derived from the stored
 * end timestamp, so a window is closed the moment it elapses even if the
 * sweep has not run yet. The sweep only brings the stored status in line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationWindowService {

    private final ConversationWindowRepository windowRepository;
    private final ConversationProperties properties;
    private final Clock clock;

    @Transactional
    public ConversationWindow create(Long organizationId, String contactPhone) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime endsAt = now.plusHours(properties.getWindowHours());

        ConversationWindow window = windowRepository.findByOrganizationIdAndContactPhone(organizationId, contactPhone)
                .orElseGet(() -> ConversationWindow.builder()
                        .organizationId(organizationId)
                        .contactPhone(contactPhone)
                        .build());
        window.restamp(now, endsAt, WindowStatus.ACTIVE);

        log.debug("Window opened: org={}, contact={}, endsAt={}", organizationId, contactPhone, endsAt);
        return windowRepository.save(window);
    }

    /** Called on every contact message: the window runs for another full period from now */
    @Transactional
    public ConversationWindow reset(Long organizationId, String contactPhone) {
        return create(organizationId, contactPhone);
    }

    @Transactional(readOnly = true)
    public WindowStatus status(Long organizationId, String contactPhone) {
        return windowRepository.findByOrganizationIdAndContactPhone(organizationId, contactPhone)
                .map(this::effectiveStatus)
                .orElse(WindowStatus.UNKNOWN);
    }

    /** Fractional hours until the window closes; 0 when closed or never opened */
    @Transactional(readOnly = true)
    public double hoursRemaining(Long organizationId, String contactPhone) {
        Optional<ConversationWindow> window =
                windowRepository.findByOrganizationIdAndContactPhone(organizationId, contactPhone);
        if (window.isEmpty() || !effectiveStatus(window.get()).allowsFreeMessages()) {
            return 0d;
        }
        Duration left = Duration.between(LocalDateTime.now(clock), window.get().getEndsAt());
        return left.isNegative() ? 0d : left.toMillis() / 3_600_000d;
    }

    /**
     * Operator override: keep the window open for {@code hours} from now.
     */
    @Transactional
    public ConversationWindow extend(Long organizationId, String contactPhone, int hours) {
        if (hours < ConversationConstants.MIN_WINDOW_EXTENSION_HOURS
                || hours > ConversationConstants.MAX_WINDOW_EXTENSION_HOURS) {
            throw InvalidRequestException.extensionOutOfRange(hours,
                    ConversationConstants.MIN_WINDOW_EXTENSION_HOURS,
                    ConversationConstants.MAX_WINDOW_EXTENSION_HOURS);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        ConversationWindow window = windowRepository.findByOrganizationIdAndContactPhone(organizationId, contactPhone)
                .orElseGet(() -> ConversationWindow.builder()
                        .organizationId(organizationId)
                        .contactPhone(contactPhone)
                        .build());
        window.restamp(now, now.plusHours(hours), WindowStatus.MANUALLY_EXTENDED);

        log.info("Window manually extended: org={}, contact={}, hours={}", organizationId, contactPhone, hours);
        return windowRepository.save(window);
    }

    /**
     * Marks elapsed windows of one organization EXPIRED.
     *
     * @return number of windows transitioned by this call
     */
    @Transactional
    public int sweep(Long organizationId) {
        int expired = windowRepository.expireElapsed(organizationId, LocalDateTime.now(clock));
        if (expired > 0) {
            log.info("Window sweep: org={}, expired={}", organizationId, expired);
        }
        return expired;
    }

    @Transactional
    public int sweepAll() {
        List<Long> organizations = windowRepository.findOrganizationsWithOpenWindows();
        int total = 0;
        for (Long organizationId : organizations) {
            total += sweep(organizationId);
        }
        return total;
    }

    public boolean canSendFree(Long organizationId, String contactPhone) {
        return status(organizationId, contactPhone).allowsFreeMessages();
    }

    /** Approved templates may be sent at any time; anything else needs an open window */
    public boolean canSendTemplate(Long organizationId, String contactPhone, MessageTemplate template) {
        if (template != null && template.isApproved()) {
            return true;
        }
        return canSendFree(organizationId, contactPhone);
    }

    private WindowStatus effectiveStatus(ConversationWindow window) {
        if (window.getStatus() == WindowStatus.EXPIRED || window.getEndsAt() == null) {
            return WindowStatus.EXPIRED;
        }
        return LocalDateTime.now(clock).isBefore(window.getEndsAt()) ? window.getStatus() : WindowStatus.EXPIRED;
    }
}
