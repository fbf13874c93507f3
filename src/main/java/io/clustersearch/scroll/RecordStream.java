package io.clustersearch.scroll;

import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.ResultDocument;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

import static io.clustersearch.metrics.MetricsConstants.RECORDS_EMITTED_METRIC_NAME;

/**
 * Lazy one-pass sequence of flattened records backed by a {@link ScrollIterator}.
 *
 * A page is requested only when the previous one has been consumed. The cursor is released when
 * the results are exhausted, when the limit is reached, when paging fails, or on {@link #close()}.
 */
@Slf4j
public class RecordStream implements Iterator<Map<String, Object>>, AutoCloseable {

    private final ScrollIterator scroll;
    private final RecordFormatter formatter;
    private final MetricsProvider metricsProvider;
    private final long limit;

    private Iterator<ResultDocument> currentPage;
    private long emitted;
    private boolean finished;

    RecordStream(ScrollIterator scroll, RecordFormatter formatter, MetricsProvider metricsProvider, long limit) {
        this.scroll = scroll;
        this.formatter = formatter;
        this.metricsProvider = metricsProvider;
        this.limit = limit;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (limit > 0 && emitted >= limit) {
            log.info("Record limit {} reached, stopping scroll", limit);
            close();
            return false;
        }
        try {
            while (currentPage == null || !currentPage.hasNext()) {
                ScrollPage page = scroll.next();
                if (page.isDone()) {
                    close();
                    return false;
                }
                currentPage = page.getDocuments().iterator();
            }
            return true;
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    @Override
    public Map<String, Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more records");
        }
        emitted++;
        metricsProvider.counter(RECORDS_EMITTED_METRIC_NAME, Map.of()).increment();
        return formatter.format(currentPage.next());
    }

    public long getEmitted() {
        return emitted;
    }

    @Override
    public void close() {
        if (finished) {
            return;
        }
        finished = true;
        currentPage = null;
        scroll.close();
    }
}
