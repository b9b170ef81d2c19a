package net.vortexdevelopment.vcache.warming;

import java.util.List;
import java.util.Map;

/**
 * Placeholder loader: empty session and navigation documents and no sub-resources.
 */
public class DefaultUserDataLoader implements UserDataLoader {

    @Override
    public Object loadSession(String userId) {
        return Map.of("userId", userId);
    }

    @Override
    public Object loadNavigation(String userId) {
        return Map.of("userId", userId, "history", List.of());
    }

    @Override
    public List<String> recentSubResources(String userId) {
        return List.of();
    }

    @Override
    public Object loadSubResource(String userId, String resourceId) {
        return Map.of("userId", userId, "resourceId", resourceId);
    }
}
