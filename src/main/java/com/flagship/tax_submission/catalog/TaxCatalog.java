package com.flagship.tax_submission.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Regulatory code tables, loaded from JSON so they can be updated without
 * a code change.
 *
 * Catalogs in use:
 * - 01: document kinds
 * - 05: tax types
 * - 06: identity document types
 * - 07: tax treatment codes
 * - 09: credit note reasons
 */
@Component
@Slf4j
public class TaxCatalog {

    public static final String DOCUMENT_KINDS = "01";
    public static final String TAX_TYPES = "05";
    public static final String IDENTITY_TYPES = "06";
    public static final String TAX_TREATMENTS = "07";
    public static final String CREDIT_NOTE_REASONS = "09";

    private final Map<String, Map<String, String>> catalogs;

    public TaxCatalog(ObjectMapper objectMapper,
                      @Value("${catalogs.location:classpath:catalogs/tax-catalogs.json}") Resource location) {
        this.catalogs = load(objectMapper, location);
    }

    public boolean contains(String catalog, String code) {
        return code != null && catalogs.getOrDefault(catalog, Map.of()).containsKey(code);
    }

    public Optional<String> describe(String catalog, String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(catalogs.getOrDefault(catalog, Map.of()).get(code));
    }

    public Set<String> codes(String catalog) {
        return catalogs.getOrDefault(catalog, Map.of()).keySet();
    }

    private static Map<String, Map<String, String>> load(ObjectMapper objectMapper, Resource location) {
        try (InputStream in = location.getInputStream()) {
            Map<String, Map<String, String>> loaded = objectMapper.readValue(in,
                new TypeReference<Map<String, Map<String, String>>>() {});
            log.info("Loaded tax catalogs {} from {}", loaded.keySet(), location.getDescription());
            return Collections.unmodifiableMap(loaded);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load tax catalogs from " + location.getDescription(), e);
        }
    }
}
