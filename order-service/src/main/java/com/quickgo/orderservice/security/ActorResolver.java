package com.quickgo.orderservice.security;

import com.quickgo.common.exception.AccessDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a Keycloak style JWT into an {@link Actor}.
 *
 * Roles are read from resource_access.quickgo-backend.roles. When a token carries
 * several roles the most privileged one wins (ADMIN, RESTAURANT, DRIVER, CUSTOMER).
 */
@Component
@Slf4j
public class ActorResolver {

    static final String CLIENT_ID = "quickgo-backend";
    static final String RESTAURANT_ID_CLAIM = "restaurant_id";

    private static final List<ActorRole> PRECEDENCE = List.of(
            ActorRole.ADMIN, ActorRole.RESTAURANT, ActorRole.DRIVER, ActorRole.CUSTOMER);

    public Actor resolve(Jwt jwt) {
        Long userId = parseUserId(jwt.getSubject());
        List<String> roles = extractClientRoles(jwt);

        for (ActorRole candidate : PRECEDENCE) {
            if (!roles.contains(candidate.name())) {
                continue;
            }
            if (candidate == ActorRole.RESTAURANT) {
                Long restaurantId = extractRestaurantId(jwt);
                if (restaurantId == null) {
                    log.warn("Restaurant token without restaurant_id claim: sub={}", jwt.getSubject());
                    throw new AccessDeniedException("Restaurant token is missing the restaurant_id claim");
                }
                return Actor.restaurant(userId, restaurantId);
            }
            return new Actor(userId, candidate, null);
        }

        log.warn("Token without a known role: sub={}, roles={}", jwt.getSubject(), roles);
        throw new AccessDeniedException("No QuickGo role granted to this user");
    }

    private Long parseUserId(String subject) {
        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            throw new AccessDeniedException("Token subject is not a QuickGo user id");
        }
    }

    private List<String> extractClientRoles(Jwt jwt) {
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(CLIENT_ID))
                .filter(Map.class::isInstance)
                .map(client -> (Map<?, ?>) client)
                .map(clientMap -> clientMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }

    private Long extractRestaurantId(Jwt jwt) {
        Object claim = jwt.getClaim(RESTAURANT_ID_CLAIM);
        if (claim == null) {
            return null;
        }
        if (claim instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.valueOf(claim.toString());
        } catch (NumberFormatException e) {
            log.warn("Invalid restaurant_id claim: value={}", claim);
            return null;
        }
    }
}
