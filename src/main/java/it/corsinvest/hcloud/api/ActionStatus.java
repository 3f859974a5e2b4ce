/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */

package it.corsinvest.hcloud.api;

/**
 * Progress state of an {@link Action}.
 */
public enum ActionStatus {
    RUNNING("running"),
    SUCCESS("success"),
    ERROR("error");

    private final String _value;

    ActionStatus(String value) {
        _value = value;
    }

    /**
     * Status as sent on the wire.
     *
     * @return String
     */
    public String getValue() {
        return _value;
    }

    /**
     * Decode a wire status.
     *
     * @param value wire status
     * @return ActionStatus or null when not recognized
     */
    public static ActionStatus fromValue(String value) {
        for (var status : values()) {
            if (status._value.equals(value)) {
                return status;
            }
        }
        return null;
    }
}
