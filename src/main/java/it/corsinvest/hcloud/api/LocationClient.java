/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Client for the locations API.
 */
public class LocationClient extends ResourceClientBase {

    protected LocationClient(HCloudClientBase client) {
        super(client);
    }

    /**
     * Read a location.
     *
     * @param id location id
     * @return Location or null when it does not exist
     * @throws HCloudException on transport or API error
     */
    public Location get(long id) throws HCloudException {
        return getById("/locations/" + id, "location", Schema.Location.class, SchemaConverter::toLocation);
    }

    /**
     * Read a location by name, for example {@code fsn1}.
     *
     * @param name location name
     * @return Location or null
     * @throws HCloudException on transport or API error
     */
    public Location getByName(String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            return null;
        }
        var opts = new NameListOpts();
        opts.setName(name);
        return first(list(opts));
    }

    /**
     * List a single page of locations.
     *
     * @param opts paging and filter options, may be null
     * @return Page
     * @throws HCloudException on transport or API error
     */
    public Page<Location> list(NameListOpts opts) throws HCloudException {
        return listPage("/locations", "locations", opts, Schema.Location.class, SchemaConverter::toLocation);
    }

    /**
     * Read all locations.
     *
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<Location> all() throws HCloudException {
        var opts = new NameListOpts();
        opts.setPerPage(ALL_PER_PAGE);
        return _client.all(page -> {
            opts.setPage(page);
            return list(opts);
        });
    }
}
