package com.trading.flow.analysis;

/**
 * A news article as delivered by the data provider.
 *
 * @param pubDate ISO-8601 timestamp with offset, unparsed; providers are not
 *                trusted to get it right.
 */
public record NewsItem(String title, String pubDate, String summary) {
}
