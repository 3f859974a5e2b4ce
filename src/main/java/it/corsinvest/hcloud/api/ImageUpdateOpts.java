/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for updating an image. Unset values are left unchanged.
 */
public class ImageUpdateOpts {

    private String _description;
    private ImageType _type;

    public String getDescription() {
        return _description;
    }

    public void setDescription(String description) {
        _description = description;
    }

    public ImageType getType() {
        return _type;
    }

    /**
     * Set new type. Only {@link ImageType#SNAPSHOT} is accepted, it turns a backup into a snapshot.
     *
     * @param type image type
     */
    public void setType(ImageType type) {
        _type = type;
    }

    /**
     * Checks if options are valid.
     *
     * @throws HCloudExceptionValidation when the type is not snapshot
     */
    public void validate() throws HCloudExceptionValidation {
        if (_type != null && _type != ImageType.SNAPSHOT) {
            throw new HCloudExceptionValidation("invalid type: " + _type.getValue());
        }
    }

    Map<String, Object> toParameters() {
        var params = new LinkedHashMap<String, Object>();
        params.put("description", _description);
        params.put("type", _type != null ? _type.getValue() : null);
        return params;
    }
}
