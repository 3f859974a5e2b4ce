/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */

package it.corsinvest.hcloud.api;

/**
 * Enumerates the request kinds issued against the Hetzner Cloud API and the
 * HTTP verb each one is sent with.
 */
public enum MethodType {
    /**
     * Read a resource or a page of resources (HTTP GET).
     */
    GET("GET"),

    /**
     * Update an existing resource (HTTP PUT).
     */
    SET("PUT"),

    /**
     * Create a resource or trigger an action on it (HTTP POST).
     */
    CREATE("POST"),

    /**
     * Remove a resource (HTTP DELETE).
     */
    DELETE("DELETE");

    private final String _httpMethod;

    MethodType(String httpMethod) {
        _httpMethod = httpMethod;
    }

    /**
     * HTTP verb used on the wire.
     *
     * @return String
     */
    public String getHttpMethod() {
        return _httpMethod;
    }
}
