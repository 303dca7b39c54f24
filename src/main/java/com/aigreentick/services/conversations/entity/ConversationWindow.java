package com.aigreentick.services.conversations.entity;

import com.aigreentick.services.conversations.constants.WindowStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * WhatsApp 24-hour customer service window for one contact of one tenant.
 *
 * The stored status is a hint; whether the window is open is always
 * decided from endsAt (see ConversationWindowService.status).
 */
@Entity
@Table(
        name = "conversation_windows",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_conversation_window",
                        columnNames = {"organization_id", "contact_phone"})
        },
        indexes = {
                @Index(name = "idx_window_sweep", columnList = "organization_id, status, ends_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "contact_phone", nullable = false, length = 30)
    private String contactPhone;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "ends_at", nullable = false)
    private LocalDateTime endsAt;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private WindowStatus status = WindowStatus.ACTIVE;

    public void restamp(LocalDateTime now, LocalDateTime newEndsAt, WindowStatus newStatus) {
        boolean closed = this.status == WindowStatus.EXPIRED
                || this.endsAt == null || !now.isBefore(this.endsAt);
        if (closed || this.startedAt == null) {
            this.startedAt = now;
        }
        this.endsAt = newEndsAt;
        this.status = newStatus;
        this.active = true;
    }
}
