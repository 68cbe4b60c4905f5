package com.asrayaos.firstflame.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

/**
 * A validated day-definition document. Only the fields the seeder relies on are lifted out;
 * the full document stays available as {@link #getDocument()}.
 */
public class ContentDefinition {
    private final int day;
    private final String title;
    private final List<JsonNode> prompts;
    private final JsonNode document;

    public ContentDefinition(int day, String title, List<JsonNode> prompts, JsonNode document) {
        this.day = day;
        this.title = title;
        this.prompts = Collections.unmodifiableList(prompts);
        this.document = document;
    }

    public int getDay() {
        return day;
    }

    /**
     * @return the document title, or {@code null} when the document has none
     */
    public String getTitle() {
        return title;
    }

    public List<JsonNode> getPrompts() {
        return prompts;
    }

    public JsonNode getDocument() {
        return document;
    }

    @Override
    public String toString() {
        return "ContentDefinition{" +
                "day=" + day +
                ", title='" + title + '\'' +
                ", prompts=" + prompts.size() +
                '}';
    }
}
