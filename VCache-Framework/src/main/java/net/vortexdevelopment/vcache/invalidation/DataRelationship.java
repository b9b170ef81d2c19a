package net.vortexdevelopment.vcache.invalidation;

import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Relationship between a written resource type and the cached data types derived from it.
 */
@Value
public class DataRelationship {

    String sourceType;
    Set<String> targetTypes;
    /** Descriptive only, e.g. {@code one_to_many}. */
    String relationshipType;
    /** Informational; expansion always runs from source to targets. */
    boolean bidirectional;
    int cascadeDepth;

    @Builder
    private DataRelationship(String sourceType, Set<String> targetTypes, @Nullable String relationshipType,
                             boolean bidirectional, @Nullable Integer cascadeDepth) {
        if (sourceType == null || sourceType.isBlank()) {
            throw new IllegalArgumentException("sourceType must not be blank");
        }
        this.sourceType = sourceType;
        this.targetTypes = targetTypes == null ? Set.of() : Set.copyOf(targetTypes);
        this.relationshipType = relationshipType == null ? "one_to_many" : relationshipType;
        this.bidirectional = bidirectional;
        this.cascadeDepth = cascadeDepth == null ? 1 : cascadeDepth;
    }

    /**
     * Tags to invalidate for a source resource: every target type, plus {@code target:id}
     * when the id is known.
     */
    public Set<String> relatedTags(@Nullable String sourceId) {
        Set<String> tags = new LinkedHashSet<>();
        for (String targetType : targetTypes) {
            ResourceTag typeOnly = ResourceTag.of(targetType);
            tags.add(typeOnly.toString());
            if (sourceId != null && !sourceId.isEmpty()) {
                tags.add(ResourceTag.of(targetType, sourceId).toString());
            }
        }
        return tags;
    }
}
