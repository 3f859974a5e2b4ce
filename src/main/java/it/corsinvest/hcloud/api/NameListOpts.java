/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.Map;

/**
 * List options with a filter on the exact resource name.
 */
public class NameListOpts extends ListOpts {

    private String _name;

    public String getName() {
        return _name;
    }

    /**
     * Only return resources with this name.
     *
     * @param name resource name
     */
    public void setName(String name) {
        _name = name;
    }

    @Override
    protected void addFilters(Map<String, Object> params) {
        params.put("name", _name);
    }
}
