package com.localdeals.ingestion.dto;

import java.util.List;

/**
 * One page of nearby search results plus the token for the following page, if any.
 */
public class PlaceSearchPage {

    private final List<PlaceSearchResult> results;
    private final String nextPageToken;

    public PlaceSearchPage(List<PlaceSearchResult> results, String nextPageToken) {
        this.results = results != null ? List.copyOf(results) : List.of();
        this.nextPageToken = nextPageToken;
    }

    public static PlaceSearchPage empty() {
        return new PlaceSearchPage(List.of(), null);
    }

    public List<PlaceSearchResult> getResults() { return results; }
    public String getNextPageToken() { return nextPageToken; }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }

    @Override
    public String toString() {
        return String.format("PlaceSearchPage{results=%d, hasNext=%s}", results.size(), hasNextPage());
    }
}
