package io.clustersearch.scroll;

import io.clustersearch.models.ResultDocument;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * One batch of hits. {@code done} pages carry no documents.
 */
@Value
public class ScrollPage {

    private static final ScrollPage DONE = new ScrollPage(Collections.emptyList(), true);

    List<ResultDocument> documents;
    boolean done;

    public static ScrollPage done() {
        return DONE;
    }

    public static ScrollPage of(List<ResultDocument> documents) {
        return new ScrollPage(documents, false);
    }
}
