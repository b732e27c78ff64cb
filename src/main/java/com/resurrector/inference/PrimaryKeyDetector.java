package com.resurrector.inference;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the field that best identifies a record of a resource.
 * <p>
 * Candidates are checked tier by tier: exact {@code id}, exact {@code _id}, resource-scoped
 * {@code {resource}_id}/{@code {resource}Id}, then any field with an id-like token. The first tier
 * with matches decides. A single match wins; several, or none at all, fall back to a field named
 * {@code id} or, failing that, the literal {@code "id"} even though no such field exists.
 */
@Slf4j
public final class PrimaryKeyDetector {

    public static final String DEFAULT_KEY = "id";

    private static final Set<String> KEY_TOKENS = Set.of("id", "key", "code", "uuid", "guid", "pk", "no", "num", "seq");

    private PrimaryKeyDetector() {
    }

    public static String detect(String resourceName, List<String> fieldNames) {
        if (fieldNames == null || fieldNames.isEmpty()) {
            return DEFAULT_KEY;
        }

        List<Predicate<String>> tiers = new ArrayList<>();
        tiers.add(field -> field.equals("id"));
        tiers.add(field -> field.equals("_id"));
        if (resourceName != null && !resourceName.isBlank()) {
            tiers.add(resourceScoped(resourceName.trim().toLowerCase(Locale.ROOT)));
        }
        tiers.add(PrimaryKeyDetector::hasKeyToken);

        // A field literally named "id" and the dangling default are the same string.
        for (Predicate<String> tier : tiers) {
            List<String> matches = fieldNames.stream().filter(tier).toList();
            if (matches.size() == 1) {
                log.debug("Primary key for '{}' resolved to '{}'", resourceName, matches.get(0));
                return matches.get(0);
            }
            if (matches.size() > 1) {
                log.debug("Ambiguous primary key candidates for '{}': {}", resourceName, matches);
                return DEFAULT_KEY;
            }
        }
        return DEFAULT_KEY;
    }

    private static Predicate<String> resourceScoped(String resourceName) {
        String singular = ResourceNames.singularize(resourceName);
        Set<String> candidates = new HashSet<>(List.of(
                singular + "_id", singular + "id",
                resourceName + "_id", resourceName + "id"));
        return field -> candidates.contains(field.toLowerCase(Locale.ROOT));
    }

    private static boolean hasKeyToken(String field) {
        for (String word : NameFormatter.words(field)) {
            if (KEY_TOKENS.contains(word.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
