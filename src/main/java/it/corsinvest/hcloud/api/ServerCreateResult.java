/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Result of creating a server.
 */
public class ServerCreateResult {

    private final Server _server;
    private final Action _action;
    private final String _rootPassword;

    public ServerCreateResult(Server server, Action action, String rootPassword) {
        _server = server;
        _action = action;
        _rootPassword = rootPassword;
    }

    public Server getServer() {
        return _server;
    }

    /**
     * Action tracking the server creation.
     *
     * @return Action
     */
    public Action getAction() {
        return _action;
    }

    /**
     * Generated root password, null when SSH keys were given.
     *
     * @return String
     */
    public String getRootPassword() {
        return _rootPassword;
    }
}
