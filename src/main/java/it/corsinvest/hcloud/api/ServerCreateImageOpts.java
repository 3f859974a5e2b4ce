/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for creating an image from a server.
 */
public class ServerCreateImageOpts {

    private ImageType _type;
    private String _description;

    public ImageType getType() {
        return _type;
    }

    /**
     * Set image type, {@link ImageType#SNAPSHOT} or {@link ImageType#BACKUP}.
     *
     * @param type image type
     */
    public void setType(ImageType type) {
        _type = type;
    }

    public String getDescription() {
        return _description;
    }

    public void setDescription(String description) {
        _description = description;
    }

    /**
     * Checks if options are valid.
     *
     * @throws HCloudExceptionValidation when the type is not snapshot or backup
     */
    public void validate() throws HCloudExceptionValidation {
        if (_type == ImageType.SYSTEM) {
            throw new HCloudExceptionValidation("invalid type: " + _type.getValue());
        }
    }

    Map<String, Object> toParameters() {
        var params = new LinkedHashMap<String, Object>();
        params.put("type", _type != null ? _type.getValue() : null);
        params.put("description", _description);
        return params;
    }
}
