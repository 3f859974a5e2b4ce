/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */

package it.corsinvest.hcloud.api;

/**
 * Power and provisioning state of a {@link Server}.
 */
public enum ServerStatus {
    INITIALIZING("initializing"),
    STARTING("starting"),
    RUNNING("running"),
    STOPPING("stopping"),
    OFF("off"),
    DELETING("deleting"),
    MIGRATING("migrating"),
    REBUILDING("rebuilding"),
    UNKNOWN("unknown");

    private final String _value;

    ServerStatus(String value) {
        _value = value;
    }

    public String getValue() {
        return _value;
    }

    /**
     * Decode a wire status.
     *
     * @param value wire status
     * @return ServerStatus, UNKNOWN when not recognized
     */
    public static ServerStatus fromValue(String value) {
        for (var status : values()) {
            if (status._value.equals(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
