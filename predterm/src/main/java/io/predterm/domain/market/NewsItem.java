package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * News article pushed on the global or a market-specific news channel.
 * Identity is {@link #id()} (a hash of the article URL upstream).
 */
public record NewsItem(
    @JsonProperty("id")
    String id,

    @JsonProperty("title")
    String title,

    @JsonProperty("url")
    String url,

    @JsonProperty("published_at")
    Instant publishedAt,

    @JsonProperty("source")
    NewsSource source,

    @JsonProperty("summary")
    String summary,

    @JsonProperty("content")
    String content,

    @JsonProperty("image_url")
    String imageUrl,

    @JsonProperty("relevance_score")
    double relevanceScore,

    @JsonProperty("related_market_ids")
    List<String> relatedMarketIds,

    @JsonProperty("search_query")
    String searchQuery
) {
    public NewsItem {
        Objects.requireNonNull(id, "id");
        relatedMarketIds = relatedMarketIds == null ? List.of() : List.copyOf(relatedMarketIds);
    }
}
