/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Resource affected by an {@link Action}.
 */
public class ActionResource {

    private final long _id;
    private final String _type;

    public ActionResource(long id, String type) {
        _id = id;
        _type = type;
    }

    public long getId() {
        return _id;
    }

    /**
     * Resource type, for example {@code server} or {@code image}.
     *
     * @return String
     */
    public String getType() {
        return _type;
    }
}
