package com.socialpulse.api.crawler;

import com.socialpulse.api.dto.ScrapeResult;
import com.socialpulse.api.entity.Source;

/**
 * One scrape cycle for one source.
 *
 * <p>Implementations must not throw on a single sub-unit failure (one subreddit, one
 * site, one query): the failure goes into {@link ScrapeResult#errors()} and the
 * remaining sub-units are still fetched. When everything fails the result has no items
 * and at least one error. Every outbound request goes through the adapter's own
 * {@link RateLimiter}. Fetched units without a title/body or a usable id are dropped
 * without being reported.
 */
public interface SourceAdapter {

    Source source();

    ScrapeResult scrape();
}
