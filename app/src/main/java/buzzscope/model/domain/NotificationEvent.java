package buzzscope.model.domain;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;

/**
 * Wire shape of one alert. Field names are stable, sinks serialize it as is.
 * Timestamps are ISO-8601 instants.
 */
public final class NotificationEvent {
    private final String keyword;
    private final String platform;
    private final EventPost post;
    @SerializedName("found_at")
    private final String foundAt;

    public NotificationEvent(String keyword, Post post, Instant foundAt) {
        this.keyword = keyword;
        this.platform = post.platform().id();
        this.post = new EventPost(post);
        this.foundAt = foundAt.toString();
    }

    public String keyword() { return keyword; }
    public String platform() { return platform; }
    public EventPost post() { return post; }
    public String foundAt() { return foundAt; }

    public static final class EventPost {
        // kept for logging, not part of the delivered JSON
        private final transient String id;
        private final String title;
        private final String body;
        private final String author;
        @SerializedName("interaction_count")
        private final long interactionCount;
        private final String url;
        private final String timestamp;

        EventPost(Post p) {
            this.id = p.id();
            this.title = p.title();
            this.body = p.body();
            this.author = p.author();
            this.interactionCount = p.interactionCount();
            this.url = p.url();
            this.timestamp = p.timestamp().toString();
        }

        public String id() { return id; }
        public String title() { return title; }
        public String body() { return body; }
        public String author() { return author; }
        public long interactionCount() { return interactionCount; }
        public String url() { return url; }
        public String timestamp() { return timestamp; }
    }
}
