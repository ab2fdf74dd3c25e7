package ai.policy.revision.model;

public enum RevisionKind {
    INSERTED,
    DELETED
}
