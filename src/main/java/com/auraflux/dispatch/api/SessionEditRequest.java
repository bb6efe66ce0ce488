package com.auraflux.dispatch.api;

import com.auraflux.core.model.ItemStatus;
import com.auraflux.core.model.ScopeElement;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for the user edit endpoints. Each endpoint reads the fields it needs.
 *
 * @param expectedVersion version the client last saw; required
 * @param text            question or reflection text, or a keyword's new text
 * @param keywords        keywords to add
 * @param scopeElements   scope elements to add
 * @param status          status of added keywords, or an item's new status
 * @param name            a scope element's new name
 * @param description     a scope element's new description
 */
public record SessionEditRequest(
    @JsonProperty("expected_version") Long expectedVersion,
    String text,
    List<String> keywords,
    @JsonProperty("scope_elements") List<ScopeElement> scopeElements,
    ItemStatus status,
    String name,
    String description
) {

    long requiredVersion() {
        if (expectedVersion == null) {
            throw new IllegalArgumentException("expected_version is required");
        }
        return expectedVersion;
    }
}
