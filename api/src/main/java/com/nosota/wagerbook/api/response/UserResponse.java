package com.nosota.wagerbook.api.response;

import java.time.Instant;

public record UserResponse(
        Long userId,
        String displayName,
        Long balance,
        Instant createdAt
) {}
