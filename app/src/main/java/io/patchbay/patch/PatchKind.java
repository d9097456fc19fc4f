package io.patchbay.patch;

/** Discriminant of {@link PatchSet}. */
public enum PatchKind {
    LOCAL("local"),
    CLOUD("cloud");

    private final String id;

    PatchKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
