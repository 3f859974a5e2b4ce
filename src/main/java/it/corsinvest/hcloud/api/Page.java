/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;

/**
 * One page of a list endpoint.
 *
 * @param <T> domain type of the items
 */
public class Page<T> {

    private final List<T> _items;
    private final Response _response;

    public Page(List<T> items, Response response) {
        _items = List.copyOf(items);
        _response = response;
    }

    /**
     * Items of this page in API order.
     *
     * @return List
     */
    public List<T> getItems() {
        return _items;
    }

    /**
     * Response the page was read from.
     *
     * @return Response
     */
    public Response getResponse() {
        return _response;
    }
}
