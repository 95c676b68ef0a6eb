package dev.microtest.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * A named piece of data recorded by a test. Strings and paths are treated as file references, anything else is
 * stored as a plain value.
 */
public record Artifact(Type type, @Nullable Object value) {

    public enum Type {
        @JsonProperty("filename")
        FILENAME,
        @JsonProperty("primitive")
        PRIMITIVE
    }

    public static Artifact of(@Nullable Object value) {
        if (value instanceof Path path) {
            return new Artifact(Type.FILENAME, path.toString());
        }
        if (value instanceof String) {
            return new Artifact(Type.FILENAME, value);
        }
        return new Artifact(Type.PRIMITIVE, value);
    }

    public boolean isFileReference() {
        return type == Type.FILENAME;
    }
}
