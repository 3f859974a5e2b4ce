/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for creating an SSH key.
 */
public class SSHKeyCreateOpts {

    private String _name;
    private String _publicKey;

    public SSHKeyCreateOpts() {
    }

    public SSHKeyCreateOpts(String name, String publicKey) {
        _name = name;
        _publicKey = publicKey;
    }

    public String getName() {
        return _name;
    }

    public void setName(String name) {
        _name = name;
    }

    public String getPublicKey() {
        return _publicKey;
    }

    /**
     * Set public key in OpenSSH format.
     *
     * @param publicKey public key
     */
    public void setPublicKey(String publicKey) {
        _publicKey = publicKey;
    }

    /**
     * Checks if options are valid.
     *
     * @throws HCloudExceptionValidation when a required value is missing
     */
    public void validate() throws HCloudExceptionValidation {
        if (_name == null || _name.isEmpty()) {
            throw new HCloudExceptionValidation("missing name");
        }
        if (_publicKey == null || _publicKey.isEmpty()) {
            throw new HCloudExceptionValidation("missing public key");
        }
    }

    Map<String, Object> toParameters() {
        var params = new LinkedHashMap<String, Object>();
        params.put("name", _name);
        params.put("public_key", _publicKey);
        return params;
    }
}
