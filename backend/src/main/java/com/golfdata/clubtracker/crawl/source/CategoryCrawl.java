package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.crawl.model.FetchError;
import com.golfdata.clubtracker.crawl.model.RawListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Lazy walk over the listing pages of one category. Pages are fetched in increasing order as
 * the iterator is drained. Each call to {@link #iterator()} restarts from the start page and
 * resets the counters.
 */
public class CategoryCrawl implements Iterable<RawListing> {
    private static final Logger log = LoggerFactory.getLogger(CategoryCrawl.class);

    private final String sourceName;
    private final String category;
    private final int startPage;
    private final int maxPages;
    private final IntFunction<CategoryPage> pageLoader;

    private int pagesFetched;
    private int pageErrors;
    private int skippedItems;
    private FetchError lastError;

    public CategoryCrawl(
        String sourceName,
        String category,
        int startPage,
        int maxPages,
        IntFunction<CategoryPage> pageLoader
    ) {
        this.sourceName = sourceName;
        this.category = category;
        this.startPage = Math.max(1, startPage);
        this.maxPages = Math.max(1, maxPages);
        this.pageLoader = pageLoader;
    }

    public String sourceName() {
        return sourceName;
    }

    public String category() {
        return category;
    }

    public int pagesFetched() {
        return pagesFetched;
    }

    public int pageErrors() {
        return pageErrors;
    }

    public int skippedItems() {
        return skippedItems;
    }

    public FetchError lastError() {
        return lastError;
    }

    public boolean aborted() {
        return pageErrors > 0;
    }

    @Override
    public Iterator<RawListing> iterator() {
        pagesFetched = 0;
        pageErrors = 0;
        skippedItems = 0;
        lastError = null;
        return new PageIterator();
    }

    private class PageIterator implements Iterator<RawListing> {
        private int nextPage = startPage;
        private Iterator<RawListing> current = Collections.emptyIterator();
        private boolean finished;

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && !finished) {
                loadNextPage();
            }
            return current.hasNext();
        }

        @Override
        public RawListing next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private void loadNextPage() {
            if (nextPage >= startPage + maxPages) {
                log.debug("{} {}: page ceiling {} reached", sourceName, category, maxPages);
                finished = true;
                return;
            }
            int page = nextPage++;
            CategoryPage result = pageLoader.apply(page);
            if (result == null || result.isFailed()) {
                pageErrors++;
                lastError = result == null ? null : result.error();
                finished = true;
                log.warn(
                    "{} {}: page {} unreachable, abandoning category ({})",
                    sourceName,
                    category,
                    page,
                    lastError == null ? "no result" : lastError.describe()
                );
                return;
            }
            pagesFetched++;
            skippedItems += result.skipped();
            if (result.isEmpty()) {
                finished = true;
                return;
            }
            current = result.listings().iterator();
        }
    }
}
