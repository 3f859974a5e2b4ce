/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of a Hetzner Cloud API request
 */
public class Response {

    private final String _reasonPhrase;
    private final int _statusCode;
    private final JsonNode _body;
    private final Map<String, List<String>> _headers;
    private final String _requestResource;
    private final Map<String, Object> _requestParameters;
    private final MethodType _methodType;
    private final Pagination _pagination;

    protected Response(JsonNode body,
            int statusCode,
            String reasonPhrase,
            Map<String, List<String>> headers,
            String requestResource,
            Map<String, Object> requestParameters,
            MethodType methodType,
            Pagination pagination) {
        _body = body;
        _statusCode = statusCode;
        _reasonPhrase = reasonPhrase;
        _headers = headers != null ? headers : Collections.emptyMap();
        _requestResource = requestResource;
        _requestParameters = requestParameters;
        _methodType = methodType;
        _pagination = pagination;
    }

    /**
     * Method type
     *
     * @return MethodType
     */
    public MethodType getMethodType() {
        return _methodType;
    }

    /**
     * Resource request
     *
     * @return String
     */
    public String getRequestResource() {
        return _requestResource;
    }

    /**
     * Request parameters, query string for GET and body for the others.
     *
     * @return Map
     */
    public Map<String, Object> getRequestParameters() {
        return _requestParameters;
    }

    /**
     * Gets the reason phrase sent by the server together with the status code.
     *
     * @return String
     */
    public String getReasonPhrase() {
        return _reasonPhrase;
    }

    /**
     * HTTP status code.
     *
     * @return int
     */
    public int getStatusCode() {
        return _statusCode;
    }

    /**
     * Gets a value that indicates if the HTTP response was successful (2xx).
     *
     * @return boolean
     */
    public boolean isSuccessStatusCode() {
        return _statusCode >= 200 && _statusCode < 300;
    }

    /**
     * Response headers, keyed by header name.
     *
     * @return Map
     */
    public Map<String, List<String>> getHeaders() {
        return _headers;
    }

    /**
     * First value of a response header.
     *
     * @param name header name
     * @return String or null when absent
     */
    public String getHeader(String name) {
        for (var entry : _headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                    && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    /**
     * Parsed JSON body, null when the response had none.
     *
     * @return JsonNode
     */
    public JsonNode getBody() {
        return _body;
    }

    /**
     * Pagination metadata, null for responses that are not paginated.
     *
     * @return Pagination
     */
    public Pagination getPagination() {
        return _pagination;
    }

    /**
     * Get if the body carries an API error object.
     *
     * @return boolean
     */
    public boolean responseInError() {
        return _body != null && _body.has("error") && _body.get("error").isObject();
    }

    /**
     * Error text in the form {@code code : message}, empty when there is no error.
     *
     * @return String
     */
    public String getError() {
        if (!responseInError()) {
            return "";
        }
        var error = _body.get("error");
        return error.path("code").asText() + " : " + error.path("message").asText();
    }
}
