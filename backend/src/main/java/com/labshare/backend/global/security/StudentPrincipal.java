package com.labshare.backend.global.security;

import java.util.UUID;

public record StudentPrincipal(UUID studentId, UUID sessionId) {
}
