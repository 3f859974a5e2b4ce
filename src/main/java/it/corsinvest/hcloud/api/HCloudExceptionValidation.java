/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Raised before any request is sent when options are missing required values.
 */
public class HCloudExceptionValidation extends HCloudException {

    /**
     * Constructor
     *
     * @param errorMessage what is wrong with the options
     */
    public HCloudExceptionValidation(String errorMessage) {
        super((Response) null, errorMessage);
    }
}
