/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Result of the server actions that hand out a new root password:
 * password reset and rescue mode.
 */
public class ServerRootPasswordResult {

    private final Action _action;
    private final String _rootPassword;

    public ServerRootPasswordResult(Action action, String rootPassword) {
        _action = action;
        _rootPassword = rootPassword;
    }

    public Action getAction() {
        return _action;
    }

    public String getRootPassword() {
        return _rootPassword;
    }
}
