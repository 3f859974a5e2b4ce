/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Hardware profile a server is created with.
 */
public class ServerType {

    private final long _id;
    private final String _name;
    private final String _description;
    private final int _cores;
    private final double _memory;
    private final int _disk;
    private final String _storageType;

    public ServerType(long id,
            String name,
            String description,
            int cores,
            double memory,
            int disk,
            String storageType) {
        _id = id;
        _name = name;
        _description = description;
        _cores = cores;
        _memory = memory;
        _disk = disk;
        _storageType = storageType;
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

    public int getCores() {
        return _cores;
    }

    /**
     * Memory in GB.
     *
     * @return double
     */
    public double getMemory() {
        return _memory;
    }

    /**
     * Disk size in GB.
     *
     * @return int
     */
    public int getDisk() {
        return _disk;
    }

    /**
     * Storage type, {@code local} or {@code network}.
     *
     * @return String
     */
    public String getStorageType() {
        return _storageType;
    }
}
