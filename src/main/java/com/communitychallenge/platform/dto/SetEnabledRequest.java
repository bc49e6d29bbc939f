package com.communitychallenge.platform.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetEnabledRequest {
    @NotNull(message = "Enabled flag cannot be null")
    private Boolean enabled;
}
