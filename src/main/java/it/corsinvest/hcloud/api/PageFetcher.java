/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Fetches a single page for {@link HCloudClientBase#all(PageFetcher)}.
 *
 * @param <T> domain type of the items
 */
@FunctionalInterface
public interface PageFetcher<T> {

    /**
     * Fetch a page.
     *
     * @param page page number, starting at 1
     * @return Page
     * @throws HCloudException on any failure, which aborts the aggregation
     */
    Page<T> fetch(int page) throws HCloudException;
}
