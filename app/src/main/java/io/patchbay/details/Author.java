package io.patchbay.details;

import org.jetbrains.annotations.Nullable;

public record Author(String id, @Nullable String name, @Nullable String email) {}
