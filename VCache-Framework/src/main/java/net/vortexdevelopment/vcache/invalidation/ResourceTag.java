package net.vortexdevelopment.vcache.invalidation;

import lombok.Value;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Typed cache tag of the form {@code type} or {@code type:id}.
 * Entries store tags as plain strings; {@link #toString()} and {@link #parse(String)}
 * convert between both representations.
 */
@Value
public class ResourceTag {

    String type;
    @Nullable
    String id;

    public static ResourceTag of(String type) {
        return new ResourceTag(type, null);
    }

    public static ResourceTag of(String type, @Nullable String id) {
        return new ResourceTag(type, id);
    }

    /**
     * Parse a string tag. Everything before the first {@code :} is the type.
     */
    public static ResourceTag parse(String tag) {
        Objects.requireNonNull(tag, "tag");
        int separator = tag.indexOf(':');
        if (separator < 0) {
            return new ResourceTag(tag, null);
        }
        return new ResourceTag(tag.substring(0, separator), tag.substring(separator + 1));
    }

    public ResourceTag(String type, @Nullable String id) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Tag type must not be blank");
        }
        this.type = type;
        this.id = id == null || id.isEmpty() ? null : id;
    }

    public boolean hasId() {
        return id != null;
    }

    @Override
    public String toString() {
        return id == null ? type : type + ":" + id;
    }
}
