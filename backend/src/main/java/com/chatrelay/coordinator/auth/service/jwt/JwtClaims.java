package com.chatrelay.coordinator.auth.service.jwt;

public record JwtClaims(
        String userId,
        String username
) {
}
