package com.resurrector.model;

import java.util.Locale;

/**
 * An HTTP method seen against a resource.
 *
 * @param method     The upper-case HTTP method.
 * @param itemScoped Whether the path addressed a single record (path parameter or id segment).
 */
public record ObservedCall(String method, boolean itemScoped) {

    public ObservedCall {
        method = method == null ? "" : method.trim().toUpperCase(Locale.ROOT);
    }
}
