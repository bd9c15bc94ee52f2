package com.agrilink.community.api.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of a listing. Page numbers are 1-based.
 *
 * @param <T> Item type
 * @author AgriLink Team
 */
@Data
@NoArgsConstructor
public class PageResponse<T> {

    private List<T> data;
    private int currentPage;
    private int perPage;
    private long total;
    private int lastPage;

    public PageResponse(List<T> data, int currentPage, int perPage, long total) {
        this.data = data;
        this.currentPage = currentPage;
        this.perPage = perPage;
        this.total = total;
        this.lastPage = perPage == 0 ? 1 : (int) Math.max(1, (total + perPage - 1) / perPage);
    }

    /**
     * Wrap converted items with the paging numbers of the page they came from.
     */
    public static <T> PageResponse<T> of(Page<?> page, List<T> data) {
        return new PageResponse<>(data, page.getNumber() + 1, page.getSize(), page.getTotalElements());
    }
}
