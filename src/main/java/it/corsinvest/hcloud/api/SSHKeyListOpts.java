/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.Map;

/**
 * Options for listing SSH keys.
 */
public class SSHKeyListOpts extends NameListOpts {

    private String _fingerprint;

    public String getFingerprint() {
        return _fingerprint;
    }

    /**
     * Only return the key with this fingerprint.
     *
     * @param fingerprint MD5 fingerprint
     */
    public void setFingerprint(String fingerprint) {
        _fingerprint = fingerprint;
    }

    @Override
    protected void addFilters(Map<String, Object> params) {
        super.addFilters(params);
        params.put("fingerprint", _fingerprint);
    }
}
