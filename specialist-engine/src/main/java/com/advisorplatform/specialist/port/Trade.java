package com.advisorplatform.specialist.port;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Trade(
    @JsonProperty("price") double price,
    @JsonProperty("size") double size,
    @JsonProperty("timestamp") Instant timestamp
) {
    public double notional() {
        return price * size;
    }
}
