/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Client for the server types API.
 */
public class ServerTypeClient extends ResourceClientBase {

    protected ServerTypeClient(HCloudClientBase client) {
        super(client);
    }

    /**
     * Read a server type.
     *
     * @param id server type id
     * @return ServerType or null when it does not exist
     * @throws HCloudException on transport or API error
     */
    public ServerType get(long id) throws HCloudException {
        return getById("/server_types/" + id, "server_type", Schema.ServerType.class, SchemaConverter::toServerType);
    }

    /**
     * Read a server type by name.
     *
     * @param name server type name
     * @return ServerType or null when none has this name
     * @throws HCloudException on transport or API error
     */
    public ServerType getByName(String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            return null;
        }
        var opts = new NameListOpts();
        opts.setName(name);
        return first(list(opts));
    }

    /**
     * List a single page of server types.
     *
     * @param opts paging and filter options, may be null
     * @return Page
     * @throws HCloudException on transport or API error
     */
    public Page<ServerType> list(NameListOpts opts) throws HCloudException {
        return listPage("/server_types", "server_types", opts, Schema.ServerType.class, SchemaConverter::toServerType);
    }

    /**
     * Read all server types.
     *
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<ServerType> all() throws HCloudException {
        var opts = new NameListOpts();
        opts.setPerPage(ALL_PER_PAGE);
        return _client.all(page -> {
            opts.setPage(page);
            return list(opts);
        });
    }
}
