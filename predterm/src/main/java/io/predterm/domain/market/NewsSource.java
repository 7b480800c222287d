package io.predterm.domain.market;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NewsSource(
    @JsonProperty("name")
    String name,

    @JsonProperty("url")
    String url,

    @JsonProperty("favicon_url")
    String faviconUrl
) {
}
