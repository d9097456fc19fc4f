package io.patchbay.patch;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** A diff read from a local file or buffer. Its contents never change; the derived fields are cached on it. */
public final class LocalPatch extends GitPatch implements PatchSet {

    private final URI contentsRef;
    private final String contents;

    public LocalPatch(URI contentsRef, String contents) {
        this.contentsRef = contentsRef;
        this.contents = contents;
    }

    public static LocalPatch fromFile(Path file) throws IOException {
        return new LocalPatch(file.toUri(), Files.readString(file, StandardCharsets.UTF_8));
    }

    @Override
    public PatchKind kind() {
        return PatchKind.LOCAL;
    }

    @Override
    public GitPatch target() {
        return this;
    }

    public URI contentsRef() {
        return contentsRef;
    }

    @Override
    public String contents() {
        return contents;
    }

    @Override
    public String toString() {
        return "LocalPatch[" + contentsRef + "]";
    }
}
