package com.advisorplatform.specialist.port;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param engagement upvotes/likes; used as the post's weight in sentiment averaging
 */
public record SocialPost(
    @JsonProperty("platform") String platform,
    @JsonProperty("text") String text,
    @JsonProperty("engagement") int engagement
) {}
