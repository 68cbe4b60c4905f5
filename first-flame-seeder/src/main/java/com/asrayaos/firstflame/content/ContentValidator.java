package com.asrayaos.firstflame.content;

import com.asrayaos.firstflame.config.SeedingConfig;
import com.asrayaos.firstflame.model.ContentDefinition;
import com.asrayaos.firstflame.seeding.FailureReason;
import com.asrayaos.firstflame.seeding.StepResult;
import com.asrayaos.firstflame.supabase.ContentStore;
import com.asrayaos.firstflame.supabase.SupabaseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fetches a day's content definition from object storage and checks its structure.
 * A definition is usable when it is a JSON object with a non-empty {@code prompts} array.
 *
 * <p>Validated definitions can be kept in a small LRU cache; with a capacity of zero every
 * call goes to storage, so a removed object is noticed on the next run. With the cache on,
 * concurrent loads of the same day share a single storage read.
 */
public class ContentValidator {
    private static final Logger logger = LoggerFactory.getLogger(ContentValidator.class);

    static final String PROMPTS_FIELD = "prompts";
    static final String DAY_FIELD = "ritualDay";
    static final String TITLE_FIELD = "title";

    private final ContentStore store;
    private final ObjectMapper objectMapper;
    private final SeedingConfig config;
    private final Map<Integer, ContentDefinition> cache;
    private final int cacheSize;
    private final ConcurrentMap<Integer, Object> loadLocks = new ConcurrentHashMap<>();

    public ContentValidator(ContentStore store, ObjectMapper objectMapper, SeedingConfig config) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.config = config;
        this.cacheSize = config.getContentCacheSize();
        this.cache = Collections.synchronizedMap(new LinkedHashMap<Integer, ContentDefinition>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, ContentDefinition> eldest) {
                return size() > cacheSize;
            }
        });
    }

    /**
     * Loads and validates the definition of one ritual day.
     *
     * @param day the ritual day, 1 to {@value SeedingConfig#TOTAL_DAYS}
     * @return the definition, or a {@link FailureReason#CONTENT_MISSING} /
     *         {@link FailureReason#CONTENT_MALFORMED} failure
     * @throws IllegalArgumentException if the day is out of range
     */
    public StepResult<ContentDefinition> loadAndValidate(int day) {
        if (day < 1 || day > SeedingConfig.TOTAL_DAYS) {
            throw new IllegalArgumentException("Ritual day must be between 1 and " + SeedingConfig.TOTAL_DAYS + ", got " + day);
        }

        String key = config.contentKey(day);
        if (cacheSize <= 0) {
            return load(key, day);
        }

        // one storage read per day while a load is in flight
        synchronized (loadLocks.computeIfAbsent(day, d -> new Object())) {
            ContentDefinition cached = cache.get(day);
            if (cached != null) {
                logger.debug("Content cache hit for day {}", day);
                return StepResult.success(cached);
            }
            StepResult<ContentDefinition> result = load(key, day);
            if (result.isSuccess()) {
                cache.put(day, result.getValue());
            }
            return result;
        }
    }

    /**
     * Drops a cached definition so the next call reads storage again.
     */
    public void evict(int day) {
        cache.remove(day);
    }

    int cachedDays() {
        return cache.size();
    }

    private StepResult<ContentDefinition> load(String key, int day) {
        byte[] bytes;
        try {
            bytes = store.fetch(key);
        } catch (SupabaseException e) {
            if (e.isObjectNotFound()) {
                logger.warn("Content object {} does not exist", key);
                return StepResult.failure(FailureReason.CONTENT_MISSING, "Content object " + key + " not found", e);
            }
            logger.warn("Content object {} could not be fetched: {}", key, e.getMessage());
            return StepResult.failure(FailureReason.CONTENT_MISSING,
                "Content object " + key + " could not be fetched: " + e.getMessage(), e);
        }

        StepResult<ContentDefinition> result = parse(key, day, bytes);
        if (result.isSuccess()) {
            logger.debug("Content for day {} validated with {} prompts", day, result.getValue().getPrompts().size());
        } else {
            logger.warn("Content object {} is malformed: {}", key, result.getMessage());
        }
        return result;
    }

    private StepResult<ContentDefinition> parse(String key, int day, byte[] bytes) {
        JsonNode document;
        try {
            document = objectMapper.readTree(bytes);
        } catch (IOException e) {
            return StepResult.failure(FailureReason.CONTENT_MALFORMED, key + " is not valid JSON: " + e.getMessage(), e);
        }
        if (document == null || !document.isObject()) {
            return StepResult.failure(FailureReason.CONTENT_MALFORMED, key + " is not a JSON object");
        }

        JsonNode prompts = document.get(PROMPTS_FIELD);
        if (prompts == null || !prompts.isArray()) {
            return StepResult.failure(FailureReason.CONTENT_MALFORMED, key + " has no '" + PROMPTS_FIELD + "' array");
        }
        if (prompts.isEmpty()) {
            return StepResult.failure(FailureReason.CONTENT_MALFORMED, key + " has an empty '" + PROMPTS_FIELD + "' array");
        }

        JsonNode ritualDay = document.get(DAY_FIELD);
        if (ritualDay != null && !ritualDay.isNull()) {
            if (!ritualDay.canConvertToInt() || ritualDay.asInt() != day) {
                return StepResult.failure(FailureReason.CONTENT_MALFORMED,
                    key + " declares " + DAY_FIELD + "=" + ritualDay + ", expected " + day);
            }
        }

        List<JsonNode> promptList = new ArrayList<>(prompts.size());
        prompts.forEach(promptList::add);
        String title = document.path(TITLE_FIELD).isTextual() ? document.get(TITLE_FIELD).textValue() : null;
        return StepResult.success(new ContentDefinition(day, title, promptList, document));
    }
}
