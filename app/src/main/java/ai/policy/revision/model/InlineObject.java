package ai.policy.revision.model;

/**
 * Non-text inline content (fields, drawings, bookmarks, comment markers) carried through untouched.
 */
public interface InlineObject {

    /**
     * Short label used in logs.
     */
    String describe();
}
