/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;
import java.util.Map;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Client for the SSH keys API.
 */
public class SSHKeyClient extends ResourceClientBase {

    protected SSHKeyClient(HCloudClientBase client) {
        super(client);
    }

    /**
     * Read an SSH key.
     *
     * @param id key id
     * @return SSHKey or null when it does not exist
     * @throws HCloudException on transport or API error
     */
    public SSHKey get(long id) throws HCloudException {
        return getById("/ssh_keys/" + id, "ssh_key", Schema.SSHKey.class, SchemaConverter::toSSHKey);
    }

    /**
     * Read an SSH key by name.
     *
     * @param name key name
     * @return SSHKey or null when no key has this name
     * @throws HCloudException on transport or API error
     */
    public SSHKey getByName(String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            return null;
        }
        var opts = new SSHKeyListOpts();
        opts.setName(name);
        return first(list(opts));
    }

    /**
     * Read an SSH key by fingerprint.
     *
     * @param fingerprint MD5 fingerprint
     * @return SSHKey or null when no key matches
     * @throws HCloudException on transport or API error
     */
    public SSHKey getByFingerprint(String fingerprint) throws HCloudException {
        if (fingerprint == null || fingerprint.isEmpty()) {
            return null;
        }
        var opts = new SSHKeyListOpts();
        opts.setFingerprint(fingerprint);
        return first(list(opts));
    }

    /**
     * List a single page of SSH keys.
     *
     * @param opts paging and filter options, may be null
     * @return Page
     * @throws HCloudException on transport or API error
     */
    public Page<SSHKey> list(SSHKeyListOpts opts) throws HCloudException {
        return listPage("/ssh_keys", "ssh_keys", opts, Schema.SSHKey.class, SchemaConverter::toSSHKey);
    }

    /**
     * Read all SSH keys.
     *
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<SSHKey> all() throws HCloudException {
        return all(new SSHKeyListOpts());
    }

    /**
     * Read all SSH keys matching the filters of the options. Page and page
     * size of the options are overwritten.
     *
     * @param opts filter options, may be null
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<SSHKey> all(SSHKeyListOpts opts) throws HCloudException {
        var listOpts = opts != null ? opts : new SSHKeyListOpts();
        listOpts.setPerPage(ALL_PER_PAGE);
        return _client.all(page -> {
            listOpts.setPage(page);
            return list(listOpts);
        });
    }

    /**
     * Create an SSH key.
     *
     * @param opts key name and public key
     * @return SSHKey created key
     * @throws HCloudException on invalid options, transport or API error
     */
    public SSHKey create(SSHKeyCreateOpts opts) throws HCloudException {
        opts.validate();
        var response = _client.create("/ssh_keys", opts.toParameters());
        return readObject(response, "ssh_key", Schema.SSHKey.class, SchemaConverter::toSSHKey);
    }

    /**
     * Rename an SSH key.
     *
     * @param id key id
     * @param name new name
     * @return SSHKey updated key
     * @throws HCloudException on transport or API error
     */
    public SSHKey update(long id, String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            throw new HCloudExceptionValidation("missing name");
        }
        var response = _client.set("/ssh_keys/" + id, Map.of("name", name));
        return readObject(response, "ssh_key", Schema.SSHKey.class, SchemaConverter::toSSHKey);
    }

    /**
     * Delete an SSH key.
     *
     * @param id key id
     * @return Response
     * @throws HCloudException on transport or API error
     */
    public Response delete(long id) throws HCloudException {
        return _client.delete("/ssh_keys/" + id, null);
    }
}
