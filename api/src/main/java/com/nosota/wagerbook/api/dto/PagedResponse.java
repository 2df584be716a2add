package com.nosota.wagerbook.api.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * One page of a newest-first listing, e.g. ledger entries.
 *
 * @param <T> element type
 */
@Getter
@Setter
@NoArgsConstructor
public class PagedResponse<T> {

    private List<T> data;
    private int pageNumber;
    private int pageSize;
    private long totalRecords;
    private int totalPages;

    /**
     * @param data         records of the current page only
     * @param pageNumber   zero-based page index
     * @param pageSize     maximum records per page
     * @param totalRecords records across all pages
     */
    public PagedResponse(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        this.data = data;
        this.pageNumber = pageNumber;
        this.pageSize = pageSize;
        this.totalRecords = totalRecords;
        this.totalPages = pageSize == 0 ? 0 : (int) ((totalRecords + pageSize - 1) / pageSize);
    }
}
