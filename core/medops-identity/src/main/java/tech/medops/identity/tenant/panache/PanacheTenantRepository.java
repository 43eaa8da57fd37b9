package tech.medops.identity.tenant.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.medops.identity.tenant.TenantRepository;
import tech.medops.identity.tenant.entity.TenantEntity;

/**
 * Panache-based implementation of TenantRepository.
 */
@ApplicationScoped
public class PanacheTenantRepository
    implements TenantRepository, PanacheRepositoryBase<TenantEntity, String> {

    @Override
    public boolean existsBySlug(String slug) {
        return count("slug", slug) > 0;
    }
}
