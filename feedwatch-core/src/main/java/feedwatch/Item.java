package feedwatch;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable content item produced by a fetch strategy.
 *
 * <p>The {@code id} is assigned by the upstream and stays stable across refetches, so it is the
 * key used for change detection and notification history. {@code publishedAt} is best-effort and
 * may be {@code null} when the strategy cannot recover a timestamp.
 *
 * @see feedwatch.spi.FetchStrategy
 */
public final class Item {
    private final String id;
    private final String url;
    private final String title;
    private final String description;
    private final Instant publishedAt;
    private final String thumbnailUrl;
    private final boolean pinned;

    private Item(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        if (this.id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
        this.url = Objects.requireNonNull(builder.url, "url");
        this.title = builder.title == null ? "" : builder.title;
        this.description = builder.description == null ? "" : builder.description;
        this.publishedAt = builder.publishedAt;
        this.thumbnailUrl = builder.thumbnailUrl;
        this.pinned = builder.pinned;
    }

    /**
     * Creates a builder for an item with the given upstream id.
     *
     * @param id stable item id
     * @return a new builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public String url() {
        return url;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    /**
     * @return publication time, or {@code null} if unknown
     */
    public Instant publishedAt() {
        return publishedAt;
    }

    /**
     * @return thumbnail URL, or {@code null} if none was found
     */
    public String thumbnailUrl() {
        return thumbnailUrl;
    }

    /**
     * Whether the upstream reported the item as pinned to the top of the profile. Pinned items may
     * be older than the newest regular item.
     */
    public boolean pinned() {
        return pinned;
    }

    public Builder toBuilder() {
        return new Builder(id)
                .url(url)
                .title(title)
                .description(description)
                .publishedAt(publishedAt)
                .thumbnailUrl(thumbnailUrl)
                .pinned(pinned);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item other)) return false;
        return pinned == other.pinned
                && id.equals(other.id)
                && url.equals(other.url)
                && title.equals(other.title)
                && description.equals(other.description)
                && Objects.equals(publishedAt, other.publishedAt)
                && Objects.equals(thumbnailUrl, other.thumbnailUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, url, title, description, publishedAt, thumbnailUrl, pinned);
    }

    @Override
    public String toString() {
        return "Item{id=" + id + ", url=" + url + ", publishedAt=" + publishedAt + "}";
    }

    /**
     * Builder for {@link Item}.
     */
    public static final class Builder {
        private final String id;
        private String url;
        private String title;
        private String description;
        private Instant publishedAt;
        private String thumbnailUrl;
        private boolean pinned;

        private Builder(String id) {
            this.id = id;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder publishedAt(Instant publishedAt) {
            this.publishedAt = publishedAt;
            return this;
        }

        public Builder thumbnailUrl(String thumbnailUrl) {
            this.thumbnailUrl = thumbnailUrl;
            return this;
        }

        public Builder pinned(boolean pinned) {
            this.pinned = pinned;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code id} or {@code url} is null
         * @throws IllegalArgumentException if {@code id} is empty
         */
        public Item build() {
            return new Item(this);
        }
    }
}
