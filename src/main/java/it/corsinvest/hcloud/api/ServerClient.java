/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;
import java.util.Map;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Client for the servers API.
 * <p>
 * Power and maintenance methods return the {@link Action} started on the
 * server; the action is usually still running when the method returns.
 */
public class ServerClient extends ResourceClientBase {

    protected ServerClient(HCloudClientBase client) {
        super(client);
    }

    /**
     * Read a server.
     *
     * @param id server id
     * @return Server or null when it does not exist
     * @throws HCloudException on transport or API error
     */
    public Server get(long id) throws HCloudException {
        return getById("/servers/" + id, "server", Schema.Server.class, SchemaConverter::toServer);
    }

    /**
     * Read a server by name.
     *
     * @param name server name
     * @return Server or null when no server has this name
     * @throws HCloudException on transport or API error
     */
    public Server getByName(String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            return null;
        }
        var opts = new ServerListOpts();
        opts.setName(name);
        return first(list(opts));
    }

    /**
     * List a single page of servers.
     *
     * @param opts paging and filter options, may be null
     * @return Page
     * @throws HCloudException on transport or API error
     */
    public Page<Server> list(ServerListOpts opts) throws HCloudException {
        return listPage("/servers", "servers", opts, Schema.Server.class, SchemaConverter::toServer);
    }

    /**
     * Read all servers.
     *
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<Server> all() throws HCloudException {
        return all(new ServerListOpts());
    }

    /**
     * Read all servers matching the filters of the options. Page and page size
     * of the options are overwritten.
     *
     * @param opts filter options, may be null
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<Server> all(ServerListOpts opts) throws HCloudException {
        var listOpts = opts != null ? opts : new ServerListOpts();
        listOpts.setPerPage(ALL_PER_PAGE);
        return _client.all(page -> {
            listOpts.setPage(page);
            return list(listOpts);
        });
    }

    /**
     * Create a server.
     *
     * @param opts server options
     * @return ServerCreateResult created server, its create action and root password
     * @throws HCloudException on invalid options, transport or API error
     */
    public ServerCreateResult create(ServerCreateOpts opts) throws HCloudException {
        opts.validate();
        var response = _client.create("/servers", opts.toParameters());
        return new ServerCreateResult(
                readObject(response, "server", Schema.Server.class, SchemaConverter::toServer),
                readAction(response),
                readRootPassword(response));
    }

    /**
     * Rename a server.
     *
     * @param id server id
     * @param name new name
     * @return Server updated server
     * @throws HCloudException on transport or API error
     */
    public Server update(long id, String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            throw new HCloudExceptionValidation("missing name");
        }
        var response = _client.set("/servers/" + id, Map.of("name", name));
        return readObject(response, "server", Schema.Server.class, SchemaConverter::toServer);
    }

    /**
     * Delete a server.
     *
     * @param id server id
     * @return Response
     * @throws HCloudException on transport or API error
     */
    public Response delete(long id) throws HCloudException {
        return _client.delete("/servers/" + id, null);
    }

    /**
     * Start a server.
     *
     * @param id server id
     * @return Action
     * @throws HCloudException on transport or API error
     */
    public Action poweron(long id) throws HCloudException {
        return executeAction(id, "poweron");
    }

    /**
     * Cut power to a server, like pulling the plug.
     *
     * @param id server id
     * @return Action
     * @throws HCloudException on transport or API error
     */
    public Action poweroff(long id) throws HCloudException {
        return executeAction(id, "poweroff");
    }

    /**
     * Soft reboot via ACPI.
     *
     * @param id server id
     * @return Action
     * @throws HCloudException on transport or API error
     */
    public Action reboot(long id) throws HCloudException {
        return executeAction(id, "reboot");
    }

    /**
     * Hard reset.
     *
     * @param id server id
     * @return Action
     * @throws HCloudException on transport or API error
     */
    public Action reset(long id) throws HCloudException {
        return executeAction(id, "reset");
    }

    /**
     * Graceful shutdown via ACPI.
     *
     * @param id server id
     * @return Action
     * @throws HCloudException on transport or API error
     */
    public Action shutdown(long id) throws HCloudException {
        return executeAction(id, "shutdown");
    }

    /**
     * Reset the root password. The server must be running with the qemu guest agent.
     *
     * @param id server id
     * @return ServerRootPasswordResult action and new root password
     * @throws HCloudException on transport or API error
     */
    public ServerRootPasswordResult resetPassword(long id) throws HCloudException {
        var response = _client.create(actionPath(id, "reset_password"), null);
        return new ServerRootPasswordResult(readAction(response), readRootPassword(response));
    }

    /**
     * Create an image (snapshot or backup) from a server.
     *
     * @param id server id
     * @param opts image options, null for API defaults
     * @return ServerCreateImageResult action and image being created
     * @throws HCloudException on invalid options, transport or API error
     */
    public ServerCreateImageResult createImage(long id, ServerCreateImageOpts opts) throws HCloudException {
        if (opts != null) {
            opts.validate();
        }
        var response = _client.create(actionPath(id, "create_image"), opts != null ? opts.toParameters() : null);
        return new ServerCreateImageResult(readAction(response),
                readObject(response, "image", Schema.Image.class, SchemaConverter::toImage));
    }

    /**
     * Boot the server into the rescue system on its next reboot.
     *
     * @param id server id
     * @param opts rescue options, null for API defaults
     * @return ServerRootPasswordResult action and root password of the rescue system
     * @throws HCloudException on transport or API error
     */
    public ServerRootPasswordResult enableRescue(long id, ServerEnableRescueOpts opts) throws HCloudException {
        var response = _client.create(actionPath(id, "enable_rescue"), opts != null ? opts.toParameters() : null);
        return new ServerRootPasswordResult(readAction(response), readRootPassword(response));
    }

    /**
     * Disable the rescue system.
     *
     * @param id server id
     * @return Action
     * @throws HCloudException on transport or API error
     */
    public Action disableRescue(long id) throws HCloudException {
        return executeAction(id, "disable_rescue");
    }

    private static String actionPath(long id, String action) {
        return "/servers/" + id + "/actions/" + action;
    }

    private Action executeAction(long id, String action) throws HCloudException {
        return readAction(_client.create(actionPath(id, action), null));
    }

    private static String readRootPassword(Response response) {
        var body = response.getBody();
        return body != null && body.hasNonNull("root_password")
                ? body.get("root_password").asText()
                : null;
    }
}
