package com.communitychallenge.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * System-wide settings. Exactly one row, always with {@link #SINGLETON_ID}.
 */
@Entity
@Table(name = "challenge_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeSettings {
    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "settings_id")
    private Integer settingsId;

    /**
     * Master switch. When off, no challenge accepts progress or shows up as active.
     */
    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    /**
     * Channel for completion announcements; null disables announcements.
     */
    @Column(name = "announcement_channel_id")
    private Long announcementChannelId;

    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    public static ChallengeSettings defaults() {
        return ChallengeSettings.builder()
            .settingsId(SINGLETON_ID)
            .enabled(true)
            .build();
    }
}
