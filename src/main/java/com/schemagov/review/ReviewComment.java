package com.schemagov.review;

import java.time.Instant;
import java.util.Objects;

public record ReviewComment(String author, String content, CommentType type, Instant timestamp) {
    public ReviewComment {
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(timestamp, "timestamp");
        content = content == null ? "" : content;
        type = type == null ? CommentType.GENERAL : type;
    }
}
