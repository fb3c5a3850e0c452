package com.tripsync.api;

import jakarta.validation.constraints.NotBlank;

public record MessageRequest(
        @NotBlank String message
) {
}
