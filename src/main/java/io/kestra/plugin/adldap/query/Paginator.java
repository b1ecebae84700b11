package io.kestra.plugin.adldap.query;

import io.kestra.plugin.adldap.models.Entry;
import lombok.Getter;

import java.util.Iterator;
import java.util.List;

/**
 * Every entry of a paged search, iterable over the slice of the current page.
 */
@Getter
public class Paginator implements Iterable<Entry> {
    private final List<Entry> results;
    private final int perPage;
    private final int currentPage;
    /** Number of pages the server returned. */
    private final int pages;

    public Paginator(List<Entry> results, int perPage, int currentPage, int pages) {
        if (perPage <= 0 || currentPage < 0) {
            throw new IllegalArgumentException(String.format("Invalid page %d of size %d", currentPage, perPage));
        }
        this.results = List.copyOf(results);
        this.perPage = perPage;
        this.currentPage = currentPage;
        this.pages = pages;
    }

    public int getCurrentOffset() {
        return currentPage * perPage;
    }

    public List<Entry> getCurrentPageResults() {
        int from = Math.min(this.getCurrentOffset(), results.size());
        int to = Math.min(from + perPage, results.size());
        return results.subList(from, to);
    }

    public int count() {
        return results.size();
    }

    @Override
    public Iterator<Entry> iterator() {
        return this.getCurrentPageResults().iterator();
    }
}
