package com.transmissionweb.feeder.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of a fetched feed document, reduced to what link resolution and dedup need.
 * The title is kept exactly as published. Custom fields keep document order.
 */
public record CandidateItem(
        String title,
        String guid,
        String link,
        List<String> enclosures,
        Map<String, String> customFields
) {
    public CandidateItem {
        enclosures = enclosures == null ? List.of() : List.copyOf(enclosures);
        customFields = customFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
    }
}
