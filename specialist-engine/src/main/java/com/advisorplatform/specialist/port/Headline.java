package com.advisorplatform.specialist.port;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Headline(
    @JsonProperty("title") String title,
    @JsonProperty("source") String source,
    @JsonProperty("publishedAt") Instant publishedAt
) {}
