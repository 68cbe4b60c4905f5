package com.asrayaos.firstflame.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A row of {@code ritual.quests}. The slug is the identity; the id is generated by the store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Quest {
    private final String id;
    private final String slug;
    private final String title;
    private final String type;
    private final String realm;
    private final boolean pinned;

    @JsonCreator
    public Quest(@JsonProperty("id") String id,
                 @JsonProperty("slug") String slug,
                 @JsonProperty("title") String title,
                 @JsonProperty("type") String type,
                 @JsonProperty("realm") String realm,
                 @JsonProperty("is_pinned") boolean pinned) {
        this.id = id;
        this.slug = slug;
        this.title = title;
        this.type = type;
        this.realm = realm;
        this.pinned = pinned;
    }

    /**
     * A quest that has not been written yet, without an id.
     */
    public static Quest draft(String slug, String title, String type, String realm, boolean pinned) {
        return new Quest(null, slug, title, type, realm, pinned);
    }

    public Quest withId(String newId) {
        return new Quest(newId, slug, title, type, realm, pinned);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("slug")
    public String getSlug() {
        return slug;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("realm")
    public String getRealm() {
        return realm;
    }

    @JsonProperty("is_pinned")
    public boolean isPinned() {
        return pinned;
    }

    @Override
    public String toString() {
        return "Quest{" +
                "id='" + id + '\'' +
                ", slug='" + slug + '\'' +
                ", title='" + title + '\'' +
                ", type='" + type + '\'' +
                ", realm='" + realm + '\'' +
                ", pinned=" + pinned +
                '}';
    }
}
