package com.placerank.service.canonicalization;

import com.placerank.model.CacheKey;
import com.placerank.model.Coordinates;
import com.placerank.model.SearchParams;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonicalizes search parameters into stable cache keys.
 *
 * Steps:
 * 1. Lower-case, trim and collapse whitespace in the query
 * 2. Round coordinates to 4 decimal places (about 11 m)
 * 3. Keep radius and type filter verbatim, drop absent parameters
 * 4. Serialize fields in sorted order
 * 5. Generate SHA-256 hash
 *
 * Target: Same logical request → same canonical form → same key
 */
@Slf4j
@Service
public class RequestKeyBuilder {

    private static final int COORDINATE_PRECISION = 4;

    private static final String SEARCH_NAMESPACE = "search:";
    private static final String DETAILS_NAMESPACE = "details:";

    /**
     * Build the key for a text search.
     */
    public CacheKey build(String query, Coordinates location, Integer radius, String typeFilter) {
        return build(SearchParams.builder()
                .query(query)
                .location(location)
                .radius(radius)
                .typeFilter(typeFilter)
                .build());
    }

    /**
     * Build the key for a text search.
     *
     * @param params search parameters
     * @return key of the form {@code search:<sha256>}
     */
    public CacheKey build(SearchParams params) {
        String canonical = canonicalize(params);
        log.trace("Canonical search request: {}", canonical);
        return new CacheKey(SEARCH_NAMESPACE + DigestUtils.sha256Hex(canonical));
    }

    /**
     * Build the key for the detail record of one place.
     */
    public CacheKey detailsKey(String placeId) {
        if (placeId == null || placeId.isBlank()) {
            throw new IllegalArgumentException("Place id must not be blank");
        }
        return new CacheKey(DETAILS_NAMESPACE + placeId.trim());
    }

    /**
     * Canonical string form of search parameters.
     */
    public String canonicalize(SearchParams params) {
        if (params == null) {
            throw new IllegalArgumentException("Search params must not be null");
        }

        // Sorted so field order never depends on how the params were assembled
        Map<String, String> fields = new TreeMap<>();
        fields.put("query", normalizeQuery(params.getQuery()));
        putIfPresent(fields, "location", formatLocation(params.getLocation()));
        putIfPresent(fields, "radius", params.getRadius() != null ? params.getRadius().toString() : null);
        putIfPresent(fields, "type", params.getTypeFilter());
        putIfPresent(fields, "language", normalizeLanguage(params.getLanguage()));

        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (!first) {
                sb.append(",");
            }
            first = false;
            sb.append("\"").append(escapeJson(field.getKey())).append("\":")
                    .append("\"").append(escapeJson(field.getValue())).append("\"");
        }
        return sb.append("}").toString();
    }

    /**
     * Normalize query text (lower-case, trim, collapse whitespace).
     */
    String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }

        return query
                .toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Round coordinates so near-duplicates collapse to one key.
     */
    String formatLocation(Coordinates location) {
        if (location == null) {
            return null;
        }
        return round(location.latitude()) + "," + round(location.longitude());
    }

    private String round(double degrees) {
        return BigDecimal.valueOf(degrees)
                .setScale(COORDINATE_PRECISION, RoundingMode.HALF_UP)
                .toPlainString();
    }

    private String normalizeLanguage(String language) {
        if (language == null || language.isBlank()) {
            return null;
        }
        return language.trim().toLowerCase(Locale.ROOT);
    }

    private void putIfPresent(Map<String, String> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }

    private String escapeJson(String text) {
        return text
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
