package net.imagetools.domain.operation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Tag of a history entry. {@link #ORIGINAL} only ever appears at sequence 0.
 */
public enum OperationKind {
    ORIGINAL("original"),
    RESIZE("resize"),
    ROTATE("rotate"),
    FLIP("flip"),
    COMPRESS("compress"),
    REMOVE_BACKGROUND("remove-background"),
    AI_EDIT("ai-edit");

    private final String wireName;

    OperationKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a kind from its wire name ({@code remove-background}) or enum name
     * ({@code REMOVE_BACKGROUND}), case-insensitively.
     */
    public static Optional<OperationKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(normalized))
            .findFirst();
    }
}
