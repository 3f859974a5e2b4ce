/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */

package it.corsinvest.hcloud.api;

/**
 * Availability of an {@link Image}.
 */
public enum ImageStatus {
    AVAILABLE("available"),
    CREATING("creating");

    private final String _value;

    ImageStatus(String value) {
        _value = value;
    }

    public String getValue() {
        return _value;
    }

    /**
     * Decode a wire status.
     *
     * @param value wire status
     * @return ImageStatus or null when not recognized
     */
    public static ImageStatus fromValue(String value) {
        for (var status : values()) {
            if (status._value.equals(value)) {
                return status;
            }
        }
        return null;
    }
}
