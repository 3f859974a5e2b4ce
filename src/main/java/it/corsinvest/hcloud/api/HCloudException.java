/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Base exception of the Hetzner Cloud client.
 */
public class HCloudException extends Exception {

    private final Response _response;

    /**
     * Constructor
     *
     * @param response response that caused the error, may be null
     * @param errorMessage error message
     */
    public HCloudException(Response response, String errorMessage) {
        super(errorMessage);
        _response = response;
    }

    /**
     * Constructor
     *
     * @param errorMessage error message
     * @param cause underlying cause
     */
    public HCloudException(String errorMessage, Throwable cause) {
        super(errorMessage, cause);
        _response = null;
    }

    /**
     * Get response, null when no response was received.
     *
     * @return Response
     */
    public Response getResponse() {
        return _response;
    }
}
