/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */

package it.corsinvest.hcloud.api;

/**
 * Error codes returned by the Hetzner Cloud API.
 */
public enum ErrorCode {
    SERVICE_ERROR("service_error"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    UNKNOWN_ERROR("unknown_error"),
    NOT_FOUND("not_found"),
    INVALID_INPUT("invalid_input"),
    FORBIDDEN("forbidden"),
    JSON_ERROR("json_error"),
    LOCKED("locked"),
    RESOURCE_LIMIT_EXCEEDED("resource_limit_exceeded"),
    RESOURCE_UNAVAILABLE("resource_unavailable"),
    UNIQUENESS_ERROR("uniqueness_error"),
    PROTECTED("protected"),
    MAINTENANCE("maintenance"),
    CONFLICT("conflict");

    private final String _value;

    ErrorCode(String value) {
        _value = value;
    }

    /**
     * Code as sent on the wire.
     *
     * @return String
     */
    public String getValue() {
        return _value;
    }

    /**
     * Decode a wire code.
     *
     * @param value wire code
     * @return ErrorCode, UNKNOWN_ERROR when not recognized
     */
    public static ErrorCode fromValue(String value) {
        for (var code : values()) {
            if (code._value.equals(value)) {
                return code;
            }
        }
        return UNKNOWN_ERROR;
    }
}
