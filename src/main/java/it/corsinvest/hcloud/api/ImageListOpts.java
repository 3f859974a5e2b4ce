/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.Map;

/**
 * Options for listing images.
 */
public class ImageListOpts extends NameListOpts {

    private ImageType _type;

    public ImageType getType() {
        return _type;
    }

    /**
     * Only return images of this type.
     *
     * @param type image type
     */
    public void setType(ImageType type) {
        _type = type;
    }

    @Override
    protected void addFilters(Map<String, Object> params) {
        super.addFilters(params);
        params.put("type", _type != null ? _type.getValue() : null);
    }
}
