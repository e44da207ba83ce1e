package com.valkyrlabs.gruff.version;

import java.util.List;

/**
 * One page of a listing. {@link #getNextCursor()} is set exactly when
 * {@link #isHasMore()} is.
 */
public class ResourcePage<T> {

    private final List<T> items;
    private final boolean hasMore;
    private final PageCursor nextCursor;

    public ResourcePage(List<T> items, boolean hasMore, PageCursor nextCursor) {
        this.items = List.copyOf(items);
        this.hasMore = hasMore;
        this.nextCursor = nextCursor;
    }

    public List<T> getItems() {
        return items;
    }

    public boolean isHasMore() {
        return hasMore;
    }

    public PageCursor getNextCursor() {
        return nextCursor;
    }
}
