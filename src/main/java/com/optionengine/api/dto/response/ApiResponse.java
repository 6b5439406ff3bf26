package com.optionengine.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope of every {@code /api} response. {@code mode} tells the caller whether the
 * figures come from the simulated matching engine (PAPER) or the live broker (LIVE).
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final String mode;
    private final T data;
    private final Instant generatedAt;

    private ApiResponse(String mode, T data, Instant generatedAt) {
        this.mode = mode;
        this.data = data;
        this.generatedAt = generatedAt;
    }

    public static <T> ApiResponse<T> ok(String mode, T data) {
        return new ApiResponse<>(mode, data, Instant.now());
    }
}
