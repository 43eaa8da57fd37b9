package tech.medops.identity.tenant;

public interface TenantRepository {

    boolean existsBySlug(String slug);
}
