package com.nosota.wagerbook.api.request;

import com.nosota.wagerbook.api.model.EventStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateEventStatusRequest(
        @NotNull(message = "Status is required")
        EventStatus status
) {
}
