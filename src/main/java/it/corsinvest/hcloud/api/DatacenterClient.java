/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Client for the datacenters API. Datacenters are read only.
 */
public class DatacenterClient extends ResourceClientBase {

    protected DatacenterClient(HCloudClientBase client) {
        super(client);
    }

    /**
     * Read a datacenter.
     *
     * @param id datacenter id
     * @return Datacenter or null when it does not exist
     * @throws HCloudException on transport or API error
     */
    public Datacenter get(long id) throws HCloudException {
        return getById("/datacenters/" + id, "datacenter", Schema.Datacenter.class, SchemaConverter::toDatacenter);
    }

    /**
     * Read a datacenter by name.
     *
     * @param name datacenter name
     * @return Datacenter or null when none has this name
     * @throws HCloudException on transport or API error
     */
    public Datacenter getByName(String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            return null;
        }
        var opts = new NameListOpts();
        opts.setName(name);
        return first(list(opts));
    }

    /**
     * List datacenters, one page.
     */
    public Page<Datacenter> list(NameListOpts opts) throws HCloudException {
        return listPage("/datacenters", "datacenters", opts, Schema.Datacenter.class, SchemaConverter::toDatacenter);
    }

    /**
     * All datacenters.
     */
    public List<Datacenter> all() throws HCloudException {
        var opts = new NameListOpts();
        opts.setPerPage(ALL_PER_PAGE);
        return _client.all(page -> {
            opts.setPage(page);
            return list(opts);
        });
    }
}
