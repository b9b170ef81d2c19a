package net.vortexdevelopment.vcache.invalidation;

import lombok.extern.slf4j.Slf4j;
import net.vortexdevelopment.vcache.debug.DebugLogger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks which cache keys are derived from which other keys.
 * <p>
 * {@code dependencies} maps a key to the keys it depends on; {@code dependents} is its exact
 * transpose and is updated in the same critical section.
 */
@Slf4j
public class DependencyTracker {

    private final Map<String, Set<String>> dependencies = new HashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Record that {@code key} depends on each of {@code dependsOn}.
     */
    public void addDependency(String key, Collection<String> dependsOn) {
        lock.lock();
        try {
            Set<String> targets = dependencies.computeIfAbsent(key, k -> new LinkedHashSet<>());
            for (String dep : dependsOn) {
                if (dep.equals(key)) {
                    continue;
                }
                targets.add(dep);
                dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(key);
            }
            if (targets.isEmpty()) {
                dependencies.remove(key);
            }
            DebugLogger.log("Dependency added: %s -> %s", key, dependsOn);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getDependencies(String key) {
        lock.lock();
        try {
            return new HashSet<>(dependencies.getOrDefault(key, Set.of()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return keys that directly depend on {@code key}
     */
    public Set<String> getDependents(String key) {
        lock.lock();
        try {
            return new HashSet<>(dependents.getOrDefault(key, Set.of()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Breadth-first walk over dependents. The start key is never part of the result.
     *
     * @param recursive false for direct dependents only
     */
    public Set<String> getAllDependents(String key, boolean recursive) {
        lock.lock();
        try {
            if (!recursive) {
                return getDependents(key);
            }
            Set<String> visited = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(key);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                if (!visited.add(current)) {
                    continue;
                }
                for (String dependent : dependents.getOrDefault(current, Set.of())) {
                    if (!visited.contains(dependent)) {
                        queue.add(dependent);
                    }
                }
            }
            visited.remove(key);
            return visited;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop the edges from {@code key} to the keys it depends on. Keys depending on
     * {@code key} keep their edges.
     */
    public void removeOutgoing(String key) {
        lock.lock();
        try {
            Set<String> targets = dependencies.remove(key);
            if (targets == null) {
                return;
            }
            for (String dep : targets) {
                Set<String> reverse = dependents.get(dep);
                if (reverse != null) {
                    reverse.remove(key);
                    if (reverse.isEmpty()) {
                        dependents.remove(dep);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every edge touching {@code key}, in both directions.
     */
    public void removeDependency(String key) {
        lock.lock();
        try {
            removeOutgoing(key);
            Set<String> reverse = dependents.remove(key);
            if (reverse != null) {
                for (String dependent : reverse) {
                    Set<String> targets = dependencies.get(dependent);
                    if (targets != null) {
                        targets.remove(key);
                        if (targets.isEmpty()) {
                            dependencies.remove(dependent);
                        }
                    }
                }
            }
            DebugLogger.log("Dependency removed: %s", key);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            dependencies.clear();
            dependents.clear();
            log.info("Cache dependencies cleared");
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of keys with at least one outgoing edge
     */
    public int size() {
        lock.lock();
        try {
            return dependencies.size();
        } finally {
            lock.unlock();
        }
    }
}
