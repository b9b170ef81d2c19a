package net.vortexdevelopment.vcache.invalidation;

/**
 * Predicate deciding whether an invalidation rule applies to a write.
 */
@FunctionalInterface
public interface RuleCondition {

    boolean matches(WriteContext context) throws Exception;
}
