package com.example.paylog.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * An SMS as delivered by the message source. Never mutated after ingestion.
 */
@Getter
@ToString
public final class RawMessage {
    private final String sender;
    private final String content;
    private final Instant receivedAt;

    @Getter(AccessLevel.NONE)
    private final String threadId;

    public RawMessage(String sender, String content, Instant receivedAt, String threadId) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.content = Objects.requireNonNull(content, "content");
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
        this.threadId = threadId;
    }

    public static RawMessage of(String sender, String content, Instant receivedAt) {
        return new RawMessage(sender, content, receivedAt, null);
    }

    public Optional<String> getThreadId() {
        return Optional.ofNullable(threadId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawMessage)) return false;
        RawMessage that = (RawMessage) o;
        return sender.equals(that.sender)
                && content.equals(that.content)
                && receivedAt.equals(that.receivedAt)
                && Objects.equals(threadId, that.threadId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sender, content, receivedAt, threadId);
    }
}
