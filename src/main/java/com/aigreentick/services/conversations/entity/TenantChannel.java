package com.aigreentick.services.conversations.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A tenant's WhatsApp sender number and the credentials used with it.
 * Secrets are stored AES-GCM encrypted (see SecretEncryptionService).
 */
@Entity
@Table(
        name = "tenant_channels",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_tenant_channel_phone", columnNames = "phone_number_id")
        },
        indexes = {
                @Index(name = "idx_tenant_channel_org", columnList = "organization_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TenantChannel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "phone_number_id", nullable = false, length = 100)
    private String phoneNumberId;

    /** Tenant's own Meta app secret; null means the global secret applies */
    @Column(name = "encrypted_app_secret", columnDefinition = "TEXT")
    private String encryptedAppSecret;

    @Column(name = "encrypted_access_token", columnDefinition = "TEXT")
    private String encryptedAccessToken;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;
}
