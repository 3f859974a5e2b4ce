/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Error reported by the API in the body of a non-2xx response.
 */
public class HCloudExceptionApi extends HCloudException {

    private final String _code;
    private final String _apiMessage;

    /**
     * Constructor
     *
     * @param response response carrying the error
     * @param code error code as sent by the API
     * @param message error message as sent by the API
     */
    public HCloudExceptionApi(Response response, String code, String message) {
        super(response, code + " : " + message);
        _code = code;
        _apiMessage = message;
    }

    /**
     * Error code as sent by the API.
     *
     * @return String
     */
    public String getCode() {
        return _code;
    }

    /**
     * Error code parsed, {@link ErrorCode#UNKNOWN_ERROR} for codes this client does not know.
     *
     * @return ErrorCode
     */
    public ErrorCode getErrorCode() {
        return ErrorCode.fromValue(_code);
    }

    /**
     * Error message as sent by the API.
     *
     * @return String
     */
    public String getApiMessage() {
        return _apiMessage;
    }

    /**
     * Whether the API reported the resource as missing.
     *
     * @return boolean
     */
    public boolean isNotFound() {
        return getErrorCode() == ErrorCode.NOT_FOUND;
    }
}
