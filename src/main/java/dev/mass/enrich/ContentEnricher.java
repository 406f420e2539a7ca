package dev.mass.enrich;

import dev.mass.scrape.ResultItem;
import java.util.List;

/**
 * One enrichment strategy. Implementations return a list of the same length and order as the
 * input and never drop an item.
 */
public interface ContentEnricher {

  List<ResultItem> enhance(List<ResultItem> items, String keywords);
}
