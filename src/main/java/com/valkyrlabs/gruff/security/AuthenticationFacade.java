package com.valkyrlabs.gruff.security;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import com.valkyrlabs.model.GraphUser;

/**
 * Maps a Spring Security {@link Authentication} onto the user id the services
 * expect. Anonymous and unauthenticated callers map to {@code null}.
 */
@Component
public class AuthenticationFacade {

    protected static final Logger logger = LoggerFactory.getLogger(AuthenticationFacade.class);

    public UUID getCurrentUserId() {
        return resolveUserId(SecurityContextHolder.getContext().getAuthentication());
    }

    public UUID resolveUserId(Authentication auth) {
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            return null;
        }
        Object principal = auth.getPrincipal();
        if (principal instanceof GraphUser user) {
            return user.getId();
        }
        if (principal instanceof UUID id) {
            return id;
        }
        String name = auth.getName();
        try {
            return name == null ? null : UUID.fromString(name);
        } catch (IllegalArgumentException e) {
            logger.warn("Authenticated principal name is not a user id: {}", name);
            return null;
        }
    }
}
