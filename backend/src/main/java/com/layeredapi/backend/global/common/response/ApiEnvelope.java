package com.layeredapi.backend.global.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body shape shared by every endpoint, success or failure.
 *
 * @param success whether the request was fulfilled
 * @param message human readable outcome
 * @param data    payload on success
 * @param error   machine readable detail on failure (an error code or a field to message map)
 * @param meta    pagination metadata for list endpoints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiEnvelope<T>(boolean success, String message, T data, Object error, PageMeta meta) {

    public static <T> ApiEnvelope<T> ok(String message, T data) {
        return new ApiEnvelope<>(true, message, data, null, null);
    }

    public static <T> ApiEnvelope<T> ok(String message, T data, PageMeta meta) {
        return new ApiEnvelope<>(true, message, data, null, meta);
    }

    public static ApiEnvelope<Void> failure(String message, Object error) {
        return new ApiEnvelope<>(false, message, null, error, null);
    }
}
