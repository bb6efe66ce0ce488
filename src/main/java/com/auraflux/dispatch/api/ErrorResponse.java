package com.auraflux.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body returned by every failed request.
 *
 * @param code    stable error code, e.g. VERSION_CONFLICT
 * @param message human-readable detail
 * @param reasons every unmet gate condition; only present for GATE_DENIED
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String code,
    String message,
    List<String> reasons
) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, null);
    }
}
