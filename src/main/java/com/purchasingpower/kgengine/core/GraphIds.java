package com.purchasingpower.kgengine.core;

import com.google.common.base.Preconditions;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Id conventions shared with the ingestion pipeline.
 *
 * @since 1.0.0
 */
public final class GraphIds {

    public static final String ACTIVITY_PREFIX = "activity_";
    public static final String CONCEPT_PREFIX = "concept_";
    public static final String EMBEDDING_PREFIX = "embedding_";
    public static final String TOPIC_PREFIX = "topic_";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private GraphIds() {
    }

    /**
     * "Machine Learning" becomes "concept_machine_learning".
     */
    public static String conceptId(String conceptName) {
        Preconditions.checkArgument(conceptName != null && !conceptName.isBlank(),
            "Concept name must not be blank");
        return CONCEPT_PREFIX + WHITESPACE.matcher(conceptName.toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    public static String activityId(String rawActivityId) {
        Preconditions.checkArgument(rawActivityId != null && !rawActivityId.isBlank(),
            "Activity id must not be blank");
        return rawActivityId.startsWith(ACTIVITY_PREFIX) ? rawActivityId : ACTIVITY_PREFIX + rawActivityId;
    }

    public static String rawActivityId(String activityNodeId) {
        Preconditions.checkNotNull(activityNodeId, "activityNodeId");
        return activityNodeId.startsWith(ACTIVITY_PREFIX)
            ? activityNodeId.substring(ACTIVITY_PREFIX.length())
            : activityNodeId;
    }

    public static String embeddingIdForActivity(String rawActivityId) {
        return EMBEDDING_PREFIX + rawActivityId(rawActivityId);
    }

    public static String sequentialTopicId(int ordinal) {
        return TOPIC_PREFIX + ordinal;
    }
}
