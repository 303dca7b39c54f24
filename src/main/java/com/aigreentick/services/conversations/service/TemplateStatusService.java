package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.constants.TemplateStatus;
import com.aigreentick.services.conversations.repository.MessageTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateStatusService {

    private final MessageTemplateRepository templateRepository;

    /**
     * Records Meta's review decision for a template.
     *
     * @return true when a known template was updated
     */
    @Transactional
    public boolean apply(String providerTemplateId, String templateName, String event, String reason) {
        TemplateStatus status = TemplateStatus.fromEvent(event);
        if (status == null) {
            log.debug("Unhandled template event '{}' for template {}", event, templateName);
            return false;
        }

        return templateRepository.findByProviderTemplateId(providerTemplateId)
                .map(template -> {
                    template.setStatus(status);
                    template.setRejectionReason(status == TemplateStatus.REJECTED ? reason : null);
                    templateRepository.save(template);

                    if (status == TemplateStatus.APPROVED) {
                        log.info("Template approved: {} ({})", template.getName(), providerTemplateId);
                    } else {
                        log.warn("Template {} is now {}: reason={}", template.getName(), status, reason);
                    }
                    return true;
                })
                .orElseGet(() -> {
                    log.warn("Template status update for unknown template id={}, name={}",
                            providerTemplateId, templateName);
                    return false;
                });
    }
}
