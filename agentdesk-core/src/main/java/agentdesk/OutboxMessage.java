package agentdesk;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound side effect to be delivered at least once through a named channel.
 *
 * <pre>{@code
 * outboxWriter.enqueue(OutboxMessage.builder("email")
 *     .recipient("jane@example.com")
 *     .subject("Meeting notes")
 *     .body("See attached notes")
 *     .header("html", "<p>See attached notes</p>")
 *     .build());
 * }</pre>
 *
 * @see agentdesk.outbox.OutboxWriter
 */
public final class OutboxMessage {
    private final String id;
    private final String channel;
    private final List<String> recipients;
    private final String subject;
    private final String body;
    private final Map<String, String> headers;

    private OutboxMessage(Builder builder) {
        this.id = builder.id == null ? UlidCreator.getMonotonicUlid().toString() : builder.id;
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        if (channel.isEmpty()) {
            throw new IllegalArgumentException("channel cannot be empty");
        }
        if (builder.recipients.isEmpty()) {
            throw new IllegalArgumentException("at least one recipient is required");
        }
        for (String recipient : builder.recipients) {
            if (recipient == null || recipient.isBlank()) {
                throw new IllegalArgumentException("recipient cannot be empty");
            }
        }
        this.recipients = Collections.unmodifiableList(new ArrayList<>(builder.recipients));
        this.subject = builder.subject == null ? "" : builder.subject;
        this.body = builder.body == null ? "" : builder.body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    }

    public static Builder builder(String channel) {
        return new Builder(channel);
    }

    public String id() {
        return id;
    }

    public String channel() {
        return channel;
    }

    public List<String> recipients() {
        return recipients;
    }

    public String subject() {
        return subject;
    }

    public String body() {
        return body;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public static final class Builder {
        private String id;
        private final String channel;
        private final List<String> recipients = new ArrayList<>();
        private String subject;
        private String body;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(String channel) {
            this.channel = channel;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipients.add(recipient);
            return this;
        }

        public Builder recipients(List<String> recipients) {
            this.recipients.addAll(recipients);
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder header(String key, String value) {
            this.headers.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        public OutboxMessage build() {
            return new OutboxMessage(this);
        }
    }
}
