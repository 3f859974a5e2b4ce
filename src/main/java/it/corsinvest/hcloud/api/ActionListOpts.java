/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.Map;

/**
 * Options for listing actions.
 */
public class ActionListOpts extends ListOpts {

    private ActionStatus _status;

    public ActionStatus getStatus() {
        return _status;
    }

    /**
     * Only return actions in this status.
     *
     * @param status action status
     */
    public void setStatus(ActionStatus status) {
        _status = status;
    }

    @Override
    protected void addFilters(Map<String, Object> params) {
        params.put("status", _status != null ? _status.getValue() : null);
    }
}
