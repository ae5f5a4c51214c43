package com.quickgo.orderservice.security;

import com.quickgo.common.exception.AccessDeniedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ActorResolver Unit Tests")
class ActorResolverTest {

    private final ActorResolver resolver = new ActorResolver();

    private Jwt token(String subject, List<String> roles, Object restaurantId) {
        Jwt.Builder builder = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject(subject)
                .claim("resource_access", Map.of(ActorResolver.CLIENT_ID, Map.of("roles", roles)));
        if (restaurantId != null) {
            builder.claim(ActorResolver.RESTAURANT_ID_CLAIM, restaurantId);
        }
        return builder.build();
    }

    @Test
    @DisplayName("customer token resolves to a customer actor")
    void shouldResolveCustomer() {
        Actor actor = resolver.resolve(token("5", List.of("CUSTOMER"), null));

        assertThat(actor.getUserId()).isEqualTo(5L);
        assertThat(actor.getRole()).isEqualTo(ActorRole.CUSTOMER);
        assertThat(actor.getRestaurantId()).isNull();
    }

    @Test
    @DisplayName("most privileged role wins when several are granted")
    void shouldPreferMostPrivilegedRole() {
        Actor actor = resolver.resolve(token("5", List.of("CUSTOMER", "DRIVER", "ADMIN"), null));

        assertThat(actor.getRole()).isEqualTo(ActorRole.ADMIN);
        assertThat(actor.isPrivileged()).isTrue();
    }

    @Test
    @DisplayName("restaurant staff carry their restaurant id")
    void shouldResolveRestaurantWithClaim() {
        Actor actor = resolver.resolve(token("8", List.of("RESTAURANT"), "7"));

        assertThat(actor.getRole()).isEqualTo(ActorRole.RESTAURANT);
        assertThat(actor.getRestaurantId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("restaurant token without restaurant_id is rejected")
    void shouldRejectRestaurantWithoutClaim() {
        assertThatThrownBy(() -> resolver.resolve(token("8", List.of("RESTAURANT"), null)))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("non numeric subject is rejected")
    void shouldRejectNonNumericSubject() {
        assertThatThrownBy(() -> resolver.resolve(token("f81d4fae-7dec", List.of("CUSTOMER"), null)))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("token with no known role is rejected")
    void shouldRejectUnknownRoles() {
        assertThatThrownBy(() -> resolver.resolve(token("5", List.of("offline_access"), null)))
                .isInstanceOf(AccessDeniedException.class);
    }
}
