package com.aigreentick.services.conversations.entity;

import com.aigreentick.services.conversations.constants.TemplateStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Local mirror of a Meta message template's approval status
 */
@Entity
@Table(
        name = "message_templates",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_template_name_lang",
                        columnNames = {"organization_id", "name", "language"})
        },
        indexes = {
                @Index(name = "idx_template_provider_id", columnList = "provider_template_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "provider_template_id", length = 100)
    private String providerTemplateId;

    @Column(name = "name", nullable = false, length = 512)
    private String name;

    @Column(name = "language", nullable = false, length = 20)
    private String language;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private TemplateStatus status = TemplateStatus.PENDING;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean isApproved() {
        return status == TemplateStatus.APPROVED;
    }
}
