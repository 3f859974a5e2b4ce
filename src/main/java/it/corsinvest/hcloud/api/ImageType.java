/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */

package it.corsinvest.hcloud.api;

/**
 * Kind of an {@link Image}.
 */
public enum ImageType {
    /**
     * Public operating system image maintained by the provider.
     */
    SYSTEM("system"),

    /**
     * Image created on demand from a server.
     */
    SNAPSHOT("snapshot"),

    /**
     * Image created by the backup schedule of a server, bound to it.
     */
    BACKUP("backup");

    private final String _value;

    ImageType(String value) {
        _value = value;
    }

    public String getValue() {
        return _value;
    }

    /**
     * Decode a wire type.
     *
     * @param value wire type
     * @return ImageType or null when not recognized
     */
    public static ImageType fromValue(String value) {
        for (var type : values()) {
            if (type._value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
