package com.communitychallenge.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSettingsRequest {
    private Boolean enabled;
    private Long announcementChannelId;

    /**
     * Removes the announcement channel; takes precedence over {@link #announcementChannelId}.
     */
    private boolean clearAnnouncementChannel;
}
