package net.vortexdevelopment.vcache.warming;

import java.util.List;

/**
 * Loads the per-user data warmed by {@link WarmingEngine#warmUserData}.
 * Implementations must not return null values.
 */
public interface UserDataLoader {

    Object loadSession(String userId) throws Exception;

    Object loadNavigation(String userId) throws Exception;

    /**
     * @return ids of the user's sub-resources, most recent first
     */
    List<String> recentSubResources(String userId) throws Exception;

    Object loadSubResource(String userId, String resourceId) throws Exception;
}
