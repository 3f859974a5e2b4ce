/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for enabling the rescue system of a server.
 */
public class ServerEnableRescueOpts {

    private String _type;
    private final List<Long> _sshKeys = new ArrayList<>();

    public String getType() {
        return _type;
    }

    /**
     * Set rescue system type, for example {@code linux64}. API default when unset.
     *
     * @param type rescue type
     */
    public void setType(String type) {
        _type = type;
    }

    public List<Long> getSSHKeys() {
        return _sshKeys;
    }

    /**
     * Add an SSH key injected into the rescue system.
     *
     * @param id SSH key id
     */
    public void addSSHKey(long id) {
        _sshKeys.add(id);
    }

    Map<String, Object> toParameters() {
        var params = new LinkedHashMap<String, Object>();
        params.put("type", _type);
        params.put("ssh_keys", _sshKeys.isEmpty() ? null : _sshKeys);
        return params;
    }
}
