package com.insightbi.platform.service.rls.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.insightbi.platform.service.rls.RlsNotFoundException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

@ExtendWith(MockitoExtension.class)
class UserContextResolverTest {

    private static final UUID USER = UUID.fromString("11111111-0000-0000-0000-000000000001");
    private static final UUID TENANT = UUID.fromString("22222222-0000-0000-0000-000000000002");

    @Mock
    private RoleAssignmentProvider roleAssignmentProvider;

    @Mock
    private UserProfileProvider userProfileProvider;

    private UserContextResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new UserContextResolver(roleAssignmentProvider, userProfileProvider);
    }

    @Test
    void resolveShouldExposeBuiltInsAndProfileAttributes() {
        when(roleAssignmentProvider.getRoles(USER, TENANT)).thenReturn(List.of("analyst", "viewer", "analyst"));
        when(roleAssignmentProvider.getGroups(USER, TENANT)).thenReturn(List.of("emea"));
        when(userProfileProvider.getProfile(USER)).thenReturn(Optional.of(Map.of("department", "finance")));

        UserContext context = resolver.resolve(USER, TENANT);

        assertThat(context.get(UserContext.USER_ID)).isEqualTo(USER.toString());
        assertThat(context.get(UserContext.TENANT_ID)).isEqualTo(TENANT.toString());
        assertThat(context.get(UserContext.WORKSPACE_ID)).isEqualTo(TENANT.toString());
        assertThat(context.getRoles()).containsExactly("analyst", "viewer");
        assertThat(context.getGroups()).containsExactly("emea");
        assertThat(context.get("department")).isEqualTo("finance");
    }

    @Test
    void resolveShouldFailWithoutMembership() {
        when(roleAssignmentProvider.getRoles(USER, TENANT)).thenReturn(List.of());

        assertThatThrownBy(() -> resolver.resolve(USER, TENANT))
            .isInstanceOfSatisfying(RlsNotFoundException.class, ex -> assertThat(ex.getKind()).isEqualTo(RlsNotFoundException.Kind.CONTEXT));
        verifyNoInteractions(userProfileProvider);
    }

    @Test
    void resolveShouldFailWhenUserHasNoProfileRow() {
        when(roleAssignmentProvider.getRoles(USER, TENANT)).thenReturn(List.of("viewer"));
        when(userProfileProvider.getProfile(USER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(USER, TENANT)).isInstanceOf(RlsNotFoundException.class);
    }

    @Test
    void resolveShouldRejectMissingIds() {
        assertThatThrownBy(() -> resolver.resolve(null, TENANT)).isInstanceOf(RlsNotFoundException.class);
        assertThatThrownBy(() -> resolver.resolve(USER, null)).isInstanceOf(RlsNotFoundException.class);
        verifyNoInteractions(roleAssignmentProvider, userProfileProvider);
    }

    @Test
    void profileCannotOverrideBuiltIns() {
        when(roleAssignmentProvider.getRoles(USER, TENANT)).thenReturn(List.of("viewer"));
        when(userProfileProvider.getProfile(USER)).thenReturn(Optional.of(Map.of("roles", List.of("admin"), "user_id", "someone-else")));

        UserContext context = resolver.resolve(USER, TENANT);

        assertThat(context.get("roles")).isEqualTo(List.of("viewer"));
        assertThat(context.get("user_id")).isEqualTo(USER.toString());
    }

    @Test
    void missingProfileAttributesAreNotDefaulted() {
        Map<String, Object> profile = new HashMap<>();
        profile.put("region", null);
        when(roleAssignmentProvider.getRoles(USER, TENANT)).thenReturn(List.of("viewer"));
        when(userProfileProvider.getProfile(USER)).thenReturn(Optional.of(profile));

        UserContext context = resolver.resolve(USER, TENANT);

        assertThat(context.contains("region")).isFalse();
        assertThat(context.contains("department")).isFalse();
    }

    @Test
    void flattenShouldUseDottedKeysForNestedObjects() {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("city", "Lyon");
        address.put("zip", null);
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("address", address);
        profile.put("regions", new ArrayList<>(Arrays.asList("EU", null, "APAC")));
        profile.put("levels", new int[] { 1, 2 });

        Map<String, Object> flat = UserContextResolver.flatten(profile);

        assertThat(flat).containsOnlyKeys("address.city", "regions", "levels");
        assertThat(flat.get("address.city")).isEqualTo("Lyon");
        assertThat(flat.get("regions")).isEqualTo(List.of("EU", "APAC"));
        assertThat(flat.get("levels")).isEqualTo(List.of(1, 2));
    }

    @Test
    void toStringShouldNotLeakAttributeValues() {
        UserContext context = UserContext.of(USER, TENANT, List.of("viewer"), List.of(), Map.of("ssn", "123-45-6789"));

        assertThat(context.toString()).contains("ssn").doesNotContain("123-45-6789");
    }

    @Test
    void flattenShouldKeepFirstValueOnDottedKeyCollision() {
        Logger logger = (Logger) LoggerFactory.getLogger(UserContextResolver.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Map<String, Object> profile = new LinkedHashMap<>();
            profile.put("a.b", "x");
            profile.put("a", Map.of("b", "y"));

            Map<String, Object> flat = UserContextResolver.flatten(profile);

            assertThat(flat).containsExactly(Map.entry("a.b", "x"));
            assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).contains("'a.b'");
                });
        } finally {
            logger.detachAppender(appender);
        }
    }
}
