package com.trading.flow.analysis;

import static com.trading.flow.analysis.AnalysisFields.*;

import com.trading.flow.state.StateSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Market sentiment from recent news.
 *
 * Only articles published within the look-back window are sent to the
 * model, newest first, capped at {@code maxArticles}. An article whose
 * publication date does not parse is skipped with a warning; it does not
 * fail the node.
 */
@Log4j2
public final class NewsAnalystNode extends ChatAnalystNode {
    public static final int DEFAULT_WINDOW_DAYS = 15;
    public static final int DEFAULT_MAX_ARTICLES = 25;

    private final Clock clock;
    private final Duration window;
    private final int maxArticles;

    /** A filtered article as presented to the model. */
    public record RecentArticle(String title, LocalDate publishDate, String summary) {
        @Override
        public String toString() {
            return "{title: " + title + ", publish_date: " + publishDate + ", summary: " + summary + "}";
        }
    }

    public NewsAnalystNode(ChatModel model) {
        this(AnalystRole.NEWS_ANALYST.nodeName(), model, Clock.systemUTC(), DEFAULT_WINDOW_DAYS,
                DEFAULT_MAX_ARTICLES);
    }

    public NewsAnalystNode(String name, ChatModel model, Clock clock, int windowDays, int maxArticles) {
        super(name, AnalystRole.NEWS_ANALYST, model, NEWS_ANALYSIS);
        if (windowDays <= 0 || maxArticles <= 0)
            throw new IllegalArgumentException("windowDays and maxArticles must be positive");
        this.clock = clock;
        this.window = Duration.ofDays(windowDays);
        this.maxArticles = maxArticles;
    }

    @Override
    protected String prompt(StateSnapshot snapshot) {
        String symbol = snapshot.get(STOCK_SYMBOL);
        List<RecentArticle> recent = recent(snapshot.getOrDefault(NEWS, NewsFeed.empty()));
        log.info("Analyzing {} recent articles about {}", recent.size(), symbol);
        return "Please analyze the following news articles related to " + symbol + ". "
                + "Provide a summary of the prevailing market sentiment, key themes, and potential impacts on the "
                + "stock's performance. News Articles: "
                + recent.stream().map(RecentArticle::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Articles strictly newer than now minus the window, newest first, at most
     * {@code maxArticles}.
     */
    public List<RecentArticle> recent(NewsFeed feed) {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(window);
        List<Dated> kept = new ArrayList<>();
        for (NewsItem item : feed.items()) {
            OffsetDateTime published = parse(item);
            if (published == null)
                continue;
            if (published.isAfter(cutoff)) {
                String title = item.title() != null ? item.title() : "No Title";
                String summary = item.summary() != null ? item.summary() : "";
                kept.add(new Dated(published, new RecentArticle(title,
                        published.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate(), summary)));
            }
        }
        return kept.stream()
                .sorted(Comparator.comparing(Dated::published).reversed())
                .limit(maxArticles)
                .map(Dated::article)
                .toList();
    }

    private static OffsetDateTime parse(NewsItem item) {
        if (item.pubDate() == null) {
            log.warn("Skipping article without a publication date: {}", item.title());
            return null;
        }
        try {
            return OffsetDateTime.parse(item.pubDate());
        } catch (DateTimeParseException e) {
            log.warn("Skipping article '{}': {}", item.title(), e.getMessage());
            return null;
        }
    }

    private record Dated(OffsetDateTime published, RecentArticle article) {
    }
}
