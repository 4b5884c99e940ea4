package com.ai.eligibility.entity;

import com.ai.eligibility.conversation.ConversationStep;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Row per conversation. Personal and car data columns hold encrypted JSON.
 */
@Entity
@Table(name = "conversation")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private ConversationStep step = ConversationStep.GREETING;

    @Lob
    @Column(name = "personal_data_encrypted")
    private String personalDataEncrypted;

    @Lob
    @Column(name = "car_data_encrypted")
    private String carDataEncrypted;

    @Column(name = "personal_confirmed", nullable = false)
    private boolean personalConfirmed;

    @Column(name = "car_confirmed", nullable = false)
    private boolean carConfirmed;

    @Lob
    @Column(name = "eligibility_result")
    private String eligibilityResult;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        if (updatedAt == null) updatedAt = Instant.now();
    }
}
