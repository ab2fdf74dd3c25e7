package ai.policy.revision.operation;

import java.util.Locale;

/**
 * Edit actions an operation list can request.
 */
public enum ActionKind {
    REPLACE("replace"),
    DELETE("delete"),
    COMMENT("comment"),
    REPLACE_WITH_IMAGE("replace_with_logo");

    private final String wireName;

    ActionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ActionKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidOperationException("action must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "replace" -> REPLACE;
            case "delete" -> DELETE;
            case "comment" -> COMMENT;
            case "replace_with_logo", "replace_with_image" -> REPLACE_WITH_IMAGE;
            default -> throw new InvalidOperationException("unknown action '" + raw.trim() + "'");
        };
    }
}
