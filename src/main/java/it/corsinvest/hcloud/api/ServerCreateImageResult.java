/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Result of creating an image from a server.
 */
public class ServerCreateImageResult {

    private final Action _action;
    private final Image _image;

    public ServerCreateImageResult(Action action, Image image) {
        _action = action;
        _image = image;
    }

    public Action getAction() {
        return _action;
    }

    /**
     * Image being created, in status {@code creating}.
     *
     * @return Image
     */
    public Image getImage() {
        return _image;
    }
}
