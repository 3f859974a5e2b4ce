/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Physical location of one or more datacenters.
 */
public class Location {

    private final long _id;
    private final String _name;
    private final String _description;
    private final String _country;
    private final String _city;
    private final double _latitude;
    private final double _longitude;

    public Location(long id,
            String name,
            String description,
            String country,
            String city,
            double latitude,
            double longitude) {
        _id = id;
        _name = name;
        _description = description;
        _country = country;
        _city = city;
        _latitude = latitude;
        _longitude = longitude;
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

    /**
     * ISO 3166-1 alpha-2 country code.
     *
     * @return String
     */
    public String getCountry() {
        return _country;
    }

    public String getCity() {
        return _city;
    }

    public double getLatitude() {
        return _latitude;
    }

    public double getLongitude() {
        return _longitude;
    }
}
