/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Raised when a request could not be built, sent or its body read back.
 */
public class HCloudExceptionTransport extends HCloudException {

    /**
     * Constructor
     *
     * @param errorMessage error message
     * @param cause I/O, JSON or conversion failure
     */
    public HCloudExceptionTransport(String errorMessage, Exception cause) {
        super(errorMessage, cause);
    }
}
