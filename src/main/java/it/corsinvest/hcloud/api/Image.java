/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.time.OffsetDateTime;

/**
 * System image, snapshot or backup a server can be created from.
 */
public class Image {

    private final long _id;
    private final String _name;
    private final ImageType _type;
    private final ImageStatus _status;
    private final String _description;
    private final Double _imageSize;
    private final double _diskSize;
    private final OffsetDateTime _created;
    private final long _createdFromId;
    private final String _createdFromName;
    private final Long _boundTo;
    private final String _osFlavor;
    private final String _osVersion;
    private final boolean _rapidDeploy;

    public Image(long id,
            String name,
            ImageType type,
            ImageStatus status,
            String description,
            Double imageSize,
            double diskSize,
            OffsetDateTime created,
            long createdFromId,
            String createdFromName,
            Long boundTo,
            String osFlavor,
            String osVersion,
            boolean rapidDeploy) {
        _id = id;
        _name = name;
        _type = type;
        _status = status;
        _description = description;
        _imageSize = imageSize;
        _diskSize = diskSize;
        _created = created;
        _createdFromId = createdFromId;
        _createdFromName = createdFromName;
        _boundTo = boundTo;
        _osFlavor = osFlavor;
        _osVersion = osVersion;
        _rapidDeploy = rapidDeploy;
    }

    public long getId() {
        return _id;
    }

    /**
     * Unique name, null for snapshots and backups.
     *
     * @return String
     */
    public String getName() {
        return _name;
    }

    public ImageType getType() {
        return _type;
    }

    public ImageStatus getStatus() {
        return _status;
    }

    public String getDescription() {
        return _description;
    }

    /**
     * Size of the image file in GB, null while the image is being created.
     *
     * @return Double
     */
    public Double getImageSize() {
        return _imageSize;
    }

    /**
     * Size of the disk contained in the image in GB.
     *
     * @return double
     */
    public double getDiskSize() {
        return _diskSize;
    }

    public OffsetDateTime getCreated() {
        return _created;
    }

    /**
     * Id of the server the image was created from, 0 for system images.
     *
     * @return long
     */
    public long getCreatedFromId() {
        return _createdFromId;
    }

    public String getCreatedFromName() {
        return _createdFromName;
    }

    /**
     * Id of the server a backup is bound to, null for other image types.
     *
     * @return Long
     */
    public Long getBoundTo() {
        return _boundTo;
    }

    public String getOsFlavor() {
        return _osFlavor;
    }

    public String getOsVersion() {
        return _osVersion;
    }

    public boolean isRapidDeploy() {
        return _rapidDeploy;
    }
}
