package io.kestra.plugin.adldap.query;

import io.kestra.plugin.adldap.client.DirectoryConnection;
import io.kestra.plugin.adldap.client.PageControl;
import io.kestra.plugin.adldap.client.RawPage;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Lazily walks the pages of a paged subtree search, threading the server cookie from one request to the next.
 * <p>
 * The walk ends once the server returns an empty cookie or a page request fails, the latter being reported by
 * {@link #isFailed()}. It can't be restarted: a new iterator issues a new search.
 */
public class PageIterator implements Iterator<RawPage> {
    private final DirectoryConnection connection;
    private final String dn;
    private final String filter;
    private final List<String> attributes;
    private final int pageSize;
    private final boolean critical;

    private byte[] cookie;
    private boolean exhausted = false;
    private boolean failed = false;
    private RawPage next;
    private int fetched = 0;

    public PageIterator(DirectoryConnection connection, String dn, String filter, List<String> attributes, int pageSize, boolean critical) {
        this.connection = connection;
        this.dn = dn;
        this.filter = filter;
        this.attributes = attributes;
        this.pageSize = pageSize;
        this.critical = critical;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }

        Optional<RawPage> page = connection.searchPage(dn, filter, attributes, PageControl.builder()
            .pageSize(pageSize)
            .critical(critical)
            .cookie(cookie)
            .build()
        );

        if (page.isEmpty()) {
            exhausted = true;
            failed = true;
            return false;
        }

        next = page.get();
        cookie = next.getCookie();
        exhausted = next.isLast();
        fetched++;
        return true;
    }

    @Override
    public RawPage next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more pages");
        }

        RawPage page = next;
        next = null;
        return page;
    }

    /**
     * @return how many pages the server returned so far.
     */
    public int getFetched() {
        return fetched;
    }

    /**
     * @return whether the walk stopped on a failed page request rather than on the last page.
     */
    public boolean isFailed() {
        return failed;
    }
}
