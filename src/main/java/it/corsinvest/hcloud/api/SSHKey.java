/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * SSH public key stored in the project.
 */
public class SSHKey {

    private final long _id;
    private final String _name;
    private final String _fingerprint;
    private final String _publicKey;

    public SSHKey(long id, String name, String fingerprint, String publicKey) {
        _id = id;
        _name = name;
        _fingerprint = fingerprint;
        _publicKey = publicKey;
    }

    public long getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    /**
     * MD5 fingerprint of the key.
     *
     * @return String
     */
    public String getFingerprint() {
        return _fingerprint;
    }

    public String getPublicKey() {
        return _publicKey;
    }
}
