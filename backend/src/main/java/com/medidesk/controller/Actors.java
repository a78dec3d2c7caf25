package com.medidesk.controller;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Resolves the acting user recorded on charges, payments and audit entries.
 */
final class Actors {

    private Actors() {
    }

    static String of(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        String username = jwt.getClaimAsString("preferred_username");
        return username != null && !username.isBlank() ? username : jwt.getSubject();
    }
}
