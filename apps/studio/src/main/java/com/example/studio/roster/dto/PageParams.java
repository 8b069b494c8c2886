package com.example.studio.roster.dto;

/**
 * 1-based paging parameters. Out-of-range values are clamped, not rejected.
 */
public record PageParams(
        int page,
        int perPage
) {
    public static final int DEFAULT_PER_PAGE = 25;
    public static final int MAX_PER_PAGE = 100;

    public PageParams {
        if (page < 1) {
            page = 1;
        }
        if (perPage < 1) {
            perPage = DEFAULT_PER_PAGE;
        }
        if (perPage > MAX_PER_PAGE) {
            perPage = MAX_PER_PAGE;
        }
    }

    public static PageParams of(Integer page, Integer perPage) {
        return new PageParams(
                page != null ? page : 1,
                perPage != null ? perPage : DEFAULT_PER_PAGE);
    }

    public long offset() {
        return (long) (page - 1) * perPage;
    }
}
