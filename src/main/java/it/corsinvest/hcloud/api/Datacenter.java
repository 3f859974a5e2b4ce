/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Datacenter servers are placed in.
 */
public class Datacenter {

    private final long _id;
    private final String _name;
    private final String _description;
    private final Location _location;

    public Datacenter(long id, String name, String description, Location location) {
        _id = id;
        _name = name;
        _description = description;
        _location = location;
    }

    public long getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public String getDescription() {
        return _description;
    }

    public Location getLocation() {
        return _location;
    }
}
