package org.dooq.ddbjson;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Raised when a value cannot be converted. The whole input unit fails, nothing is dropped silently.
 *
 * @author alex
 */
public class ConversionException extends RuntimeException {

    private final ErrorKind kind;
    private final String path;
    private final String detail;

    public ConversionException(@NotNull ErrorKind kind, @Nullable String path, @NotNull String detail) {
        this(kind, path, detail, null);
    }

    public ConversionException(@NotNull ErrorKind kind, @Nullable String path, @NotNull String detail, @Nullable Throwable cause) {
        super(path == null ? detail : "%s (at %s)".formatted(detail, path), cause);
        this.kind = kind;
        this.path = path;
        this.detail = detail;
    }

    public @NotNull ErrorKind getKind() {
        return kind;
    }

    /**
     * JSON path of the offending value, e.g. {@code $.user.tags[2]}, or null when unknown.
     */
    public @Nullable String getPath() {
        return path;
    }

    public @NotNull String getDetail() {
        return detail;
    }

    /**
     * Same failure located at the given absolute path.
     */
    @Contract("_ -> new")
    public @NotNull ConversionException at(@NotNull String path) {
        return new ConversionException(kind, path, detail, this);
    }

    /**
     * Same failure one level further down, {@code segment} being {@code .key} or {@code [index]}.
     * Containers call this while unwinding so the innermost value ends up with the full path.
     */
    @Contract("_ -> new")
    public @NotNull ConversionException within(@NotNull String segment) {
        var rest = path == null ? "" : path.substring(1);
        var cause = getCause() instanceof ConversionException ? getCause() : this;

        return new ConversionException(kind, "$" + segment + rest, detail, cause);
    }

    /**
     * Puts a path-less failure at the root.
     */
    public @NotNull ConversionException rooted() {
        return path == null ? at("$") : this;
    }
}
