package net.vortexdevelopment.vcache.invalidation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Describes a data write that may require cache invalidation.
 */
@Value
@Builder
public class WriteContext {

    String resourceType;
    @Nullable
    String resourceId;
    @Builder.Default
    WriteOperation operation = WriteOperation.UPDATE;
    @Singular
    Map<String, Object> attributes;

    @Nullable
    public Object getAttribute(String name) {
        return attributes.get(name);
    }
}
