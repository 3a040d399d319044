package com.planforge.common.security;

import java.util.UUID;

public record AuthenticatedUser(
        UUID userId,
        String email,
        UserRole role
) {
}
