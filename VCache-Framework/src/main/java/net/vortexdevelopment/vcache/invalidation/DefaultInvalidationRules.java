package net.vortexdevelopment.vcache.invalidation;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Built-in relationships and rules for the common resource types.
 */
@Slf4j
public final class DefaultInvalidationRules {

    public static final DataRelationship USER_RELATIONSHIP = DataRelationship.builder()
            .sourceType("user")
            .targetTypes(Set.of("user_session", "user_preferences", "user_forms", "navigation"))
            .relationshipType("one_to_many")
            .cascadeDepth(2)
            .build();

    public static final DataRelationship FORM_RELATIONSHIP = DataRelationship.builder()
            .sourceType("form")
            .targetTypes(Set.of("form_state", "form_snapshot", "widget_state"))
            .relationshipType("one_to_many")
            .cascadeDepth(1)
            .build();

    public static final DataRelationship PRODUCT_RELATIONSHIP = DataRelationship.builder()
            .sourceType("product")
            .targetTypes(Set.of("pricing", "calculation", "computed", "query"))
            .relationshipType("one_to_many")
            .cascadeDepth(2)
            .build();

    private DefaultInvalidationRules() {
    }

    public static List<InvalidationRule> rules() {
        return List.of(
                InvalidationRule.builder()
                        .name("user_data_invalidation")
                        .triggerTag(ResourceTag.of("user"))
                        .triggerTag(ResourceTag.of("user_profile"))
                        .invalidateTags(Set.of("user_session", "user_preferences", "user_forms"))
                        .strategy(InvalidationStrategy.IMMEDIATE)
                        .priority(100)
                        .relationship(USER_RELATIONSHIP)
                        .description("Invalidate user caches when user data changes")
                        .build(),
                InvalidationRule.builder()
                        .name("form_data_invalidation")
                        .triggerTag(ResourceTag.of("form"))
                        .triggerTag(ResourceTag.of("form_data"))
                        .invalidateTags(Set.of("form_state", "form_snapshot"))
                        .strategy(InvalidationStrategy.BATCHED)
                        .priority(50)
                        .relationship(FORM_RELATIONSHIP)
                        .description("Invalidate form caches when form data changes")
                        .build(),
                InvalidationRule.builder()
                        .name("session_invalidation")
                        .triggerTag(ResourceTag.of("session"))
                        .invalidateTags(Set.of("user_session", "navigation"))
                        .strategy(InvalidationStrategy.IMMEDIATE)
                        .priority(90)
                        .description("Invalidate session caches when session changes")
                        .build(),
                InvalidationRule.builder()
                        .name("data_change_invalidation")
                        .triggerTag(ResourceTag.of("product"))
                        .triggerTag(ResourceTag.of("pricing"))
                        .triggerTag(ResourceTag.of("calculation"))
                        .invalidateTags(Set.of("computed", "query"))
                        .strategy(InvalidationStrategy.CASCADE)
                        .priority(70)
                        .relationship(PRODUCT_RELATIONSHIP)
                        .description("Invalidate computed caches when source data changes")
                        .build(),
                InvalidationRule.builder()
                        .name("widget_state_invalidation")
                        .triggerTag(ResourceTag.of("widget"))
                        .triggerTag(ResourceTag.of("widget_state"))
                        .invalidateTag("form_state")
                        .strategy(InvalidationStrategy.BATCHED)
                        .priority(30)
                        .description("Invalidate form state when widget changes")
                        .build(),
                InvalidationRule.builder()
                        .name("job_result_invalidation")
                        .triggerTag(ResourceTag.of("job"))
                        .triggerTag(ResourceTag.of("job_result"))
                        .invalidateTag("computed")
                        .strategy(InvalidationStrategy.IMMEDIATE)
                        .priority(60)
                        .description("Invalidate computed caches when job completes")
                        .build());
    }

    /**
     * Register the default relationships and rules with the engine.
     */
    public static void install(InvalidationEngine engine) {
        List<InvalidationRule> rules = rules();
        for (InvalidationRule rule : rules) {
            engine.registerRule(rule);
        }
        log.info("Default invalidation rules installed rules={}", rules.size());
    }
}
