package tech.medops.identity.account;

import tech.medops.identity.shared.TsidGenerator;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * URL-safe tenant slugs derived from the facility name.
 */
final class TenantSlugs {

    static final String FALLBACK = "tenant";
    static final int SUFFIX_LENGTH = 6;
    static final int MAX_LENGTH = 100;

    private TenantSlugs() {
    }

    /**
     * Lowercase, runs of non-alphanumerics collapsed to '-', no leading or
     * trailing '-'. Blank input gives {@value #FALLBACK}.
     */
    static String slugify(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String slug = name.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? FALLBACK : slug;
    }

    /**
     * Shorten a slug so a dash and suffix still fit in {@value #MAX_LENGTH}.
     */
    static String truncate(String slug) {
        int limit = MAX_LENGTH - 1 - SUFFIX_LENGTH;
        if (slug.length() <= limit) {
            return slug;
        }
        String cut = slug.substring(0, limit).replaceAll("-+$", "");
        return cut.isEmpty() ? FALLBACK : cut;
    }

    /**
     * Slug for {@code name} that {@code taken} does not report as used.
     * Collisions get a short random suffix until a free one is found.
     */
    static String uniqueSlug(String name, Predicate<String> taken) {
        String base = truncate(slugify(name));
        String candidate = base;
        while (taken.test(candidate)) {
            candidate = base + "-" + TsidGenerator.randomSuffix(SUFFIX_LENGTH);
        }
        return candidate;
    }
}
