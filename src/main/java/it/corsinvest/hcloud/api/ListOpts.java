/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Paging options shared by every list endpoint. Subclasses add their filters.
 */
public class ListOpts {

    private int _page;
    private int _perPage;

    /**
     * Page number, not sent when 0.
     *
     * @return int
     */
    public int getPage() {
        return _page;
    }

    /**
     * Set page number.
     *
     * @param page page number starting at 1
     */
    public void setPage(int page) {
        _page = page;
    }

    /**
     * Entries per page, not sent when 0.
     *
     * @return int
     */
    public int getPerPage() {
        return _perPage;
    }

    /**
     * Set entries per page.
     *
     * @param perPage entries per page
     */
    public void setPerPage(int perPage) {
        _perPage = perPage;
    }

    /**
     * Query parameters for these options. Null values are dropped by the transport.
     *
     * @return Map
     */
    public Map<String, Object> toParameters() {
        var params = new LinkedHashMap<String, Object>();
        if (_page > 0) {
            params.put("page", _page);
        }
        if (_perPage > 0) {
            params.put("per_page", _perPage);
        }
        addFilters(params);
        return params;
    }

    /**
     * Hook for subclasses to add their filters.
     *
     * @param params query parameters
     */
    protected void addFilters(Map<String, Object> params) {
    }
}
