package tech.medops.identity.account;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TenantSlugsTest {

    @ParameterizedTest
    @CsvSource({
        "Demo Clinic, demo-clinic",
        "'  Sunrise   Health Care!! ', sunrise-health-care",
        "St. Mary's #2, st-mary-s-2",
        "ABC123, abc123"
    })
    void slugify_shouldProduceUrlSafeSlug(String name, String expected) {
        assertThat(TenantSlugs.slugify(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"!!!", "   "})
    void slugify_shouldFallBack_whenNothingUsable(String name) {
        assertThat(TenantSlugs.slugify(name)).isEqualTo(TenantSlugs.FALLBACK);
    }

    @Test
    void uniqueSlug_shouldReturnBase_whenFree() {
        assertThat(TenantSlugs.uniqueSlug("Demo Clinic", slug -> false)).isEqualTo("demo-clinic");
    }

    @Test
    void uniqueSlug_shouldAppendSuffix_whenBaseTaken() {
        Set<String> taken = Set.of("demo-clinic");

        String slug = TenantSlugs.uniqueSlug("Demo Clinic", taken::contains);

        assertThat(slug).matches("demo-clinic-[0-9a-z]{6}");
    }

    @Test
    void uniqueSlug_shouldFitColumn_whenNameVeryLong() {
        String name = "a".repeat(200);

        String free = TenantSlugs.uniqueSlug(name, slug -> false);
        String suffixed = TenantSlugs.uniqueSlug(name, Set.of(free)::contains);

        assertThat(free).hasSize(TenantSlugs.MAX_LENGTH - 1 - TenantSlugs.SUFFIX_LENGTH);
        assertThat(suffixed).hasSize(TenantSlugs.MAX_LENGTH).startsWith(free + "-");
    }

    @Test
    void truncate_shouldNotEndWithDash_whenCutFallsOnSeparator() {
        String slug = "a".repeat(92) + "-" + "b".repeat(20);

        assertThat(TenantSlugs.truncate(slug)).isEqualTo("a".repeat(92));
    }
}
