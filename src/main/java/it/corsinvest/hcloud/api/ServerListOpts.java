/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.Map;

/**
 * Options for listing servers.
 */
public class ServerListOpts extends NameListOpts {

    private ServerStatus _status;

    public ServerStatus getStatus() {
        return _status;
    }

    /**
     * Only return servers in this status.
     *
     * @param status server status
     */
    public void setStatus(ServerStatus status) {
        _status = status;
    }

    @Override
    protected void addFilters(Map<String, Object> params) {
        super.addFilters(params);
        params.put("status", _status != null ? _status.getValue() : null);
    }
}
