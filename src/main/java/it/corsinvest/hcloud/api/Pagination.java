/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Pagination metadata returned in {@code meta.pagination} of list responses.
 * Page numbers that the API reports as {@code null} are exposed as 0.
 */
public class Pagination {

    private final int _page;
    private final int _perPage;
    private final int _previousPage;
    private final int _nextPage;
    private final int _lastPage;
    private final int _totalEntries;

    public Pagination(int page, int perPage, int previousPage, int nextPage, int lastPage, int totalEntries) {
        _page = page;
        _perPage = perPage;
        _previousPage = previousPage;
        _nextPage = nextPage;
        _lastPage = lastPage;
        _totalEntries = totalEntries;
    }

    /**
     * Current page number.
     *
     * @return int
     */
    public int getPage() {
        return _page;
    }

    /**
     * Entries per page.
     *
     * @return int
     */
    public int getPerPage() {
        return _perPage;
    }

    /**
     * Previous page number, 0 when on the first page.
     *
     * @return int
     */
    public int getPreviousPage() {
        return _previousPage;
    }

    /**
     * Next page number, 0 when on the last page.
     *
     * @return int
     */
    public int getNextPage() {
        return _nextPage;
    }

    /**
     * Last page number.
     *
     * @return int
     */
    public int getLastPage() {
        return _lastPage;
    }

    /**
     * Total number of entries across all pages.
     *
     * @return int
     */
    public int getTotalEntries() {
        return _totalEntries;
    }

    /**
     * Whether the given page is the last one.
     *
     * @param page page number
     * @return boolean
     */
    public boolean isLastPage(int page) {
        return page >= _lastPage;
    }
}
