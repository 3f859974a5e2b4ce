/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Base of the per resource clients.
 */
public abstract class ResourceClientBase {

    /**
     * Page size used by the {@code all} methods.
     */
    public static final int ALL_PER_PAGE = 50;

    protected final HCloudClientBase _client;

    protected ResourceClientBase(HCloudClientBase client) {
        _client = client;
    }

    /**
     * Read a single resource, mapping {@code not_found} to null.
     */
    protected <S, T> T getById(String resource, String field, Class<S> type, Function<S, T> converter)
            throws HCloudException {
        Response response;
        try {
            response = _client.get(resource, null);
        } catch (HCloudExceptionApi ex) {
            if (ex.isNotFound()) {
                return null;
            }
            throw ex;
        }
        return readObject(response, field, type, converter);
    }

    /**
     * Read one page of a list endpoint.
     */
    protected <S, T> Page<T> listPage(String resource,
            String field,
            ListOpts opts,
            Class<S> type,
            Function<S, T> converter) throws HCloudException {
        var response = _client.get(resource, opts != null ? opts.toParameters() : null);
        var wire = _client.readList(response, field, type);
        List<T> items = convert(field, wire, w -> SchemaConverter.toList(w, converter));
        return new Page<>(items, response);
    }

    /**
     * Read a field of the response and convert it into a domain object.
     */
    protected <S, T> T readObject(Response response, String field, Class<S> type, Function<S, T> converter)
            throws HCloudExceptionTransport {
        return convert(field, _client.readField(response, field, type), converter);
    }

    private static <S, T> T convert(String field, S wire, Function<S, T> converter)
            throws HCloudExceptionTransport {
        try {
            return converter.apply(wire);
        } catch (DateTimeParseException ex) {
            throw new HCloudExceptionTransport("Invalid '" + field + "' in response", ex);
        }
    }

    /**
     * First item of a page, null when the page is empty.
     */
    protected static <T> T first(Page<T> page) {
        return page.getItems().isEmpty() ? null : page.getItems().get(0);
    }

    /**
     * Read the {@code action} field of a response.
     */
    protected Action readAction(Response response) throws HCloudException {
        return readObject(response, "action", Schema.Action.class, SchemaConverter::toAction);
    }
}
