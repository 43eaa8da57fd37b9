package tech.medops.identity.common.panache;

import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.medops.identity.authorization.UserRole;
import tech.medops.identity.tenant.Tenant;
import tech.medops.identity.tenant.entity.TenantEntity;
import tech.medops.identity.user.PasswordHistory;
import tech.medops.identity.user.User;
import tech.medops.identity.user.entity.UserEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PanacheAggregateRegistry timestamping.
 */
@ExtendWith(MockitoExtension.class)
class PanacheAggregateRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    EntityManager em;

    private PanacheAggregateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PanacheAggregateRegistry();
        registry.em = em;
        registry.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("persist should stamp missing timestamps from the injected clock")
    void persist_shouldUseInjectedClock_whenTimestampsMissing() {
        // Arrange
        Tenant tenant = new Tenant();
        tenant.id = "ten_0000000000001";
        PasswordHistory entry = new PasswordHistory();
        entry.id = "pwh_0000000000001";

        // Act
        registry.persist(tenant);
        registry.persist(entry);

        // Assert
        assertThat(tenant.createdAt).isEqualTo(NOW);
        assertThat(tenant.updatedAt).isEqualTo(NOW);
        assertThat(entry.createdAt).isEqualTo(NOW);
        verify(em).persist(any(TenantEntity.class));
    }

    @Test
    @DisplayName("persist should keep an existing creation time and refresh the update time")
    void persist_shouldKeepCreatedAt_whenAlreadySet() {
        // Arrange
        Instant created = NOW.minusSeconds(3600);
        User user = new User();
        user.id = "usr_0000000000001";
        user.role = UserRole.NURSE;
        user.createdAt = created;

        // Act
        registry.persist(user);

        // Assert
        assertThat(user.createdAt).isEqualTo(created);
        assertThat(user.updatedAt).isEqualTo(NOW);
        verify(em).persist(any(UserEntity.class));
    }

    @Test
    @DisplayName("persist should reject an unregistered aggregate type")
    void persist_shouldThrow_whenTypeUnknown() {
        assertThatThrownBy(() -> registry.persist("not an aggregate"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("java.lang.String");
        verifyNoInteractions(em);
    }
}
