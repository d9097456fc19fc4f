package io.patchbay.git;

import org.jetbrains.annotations.Nullable;

/** Identity from git config; either part may be missing. */
public record GitUser(@Nullable String name, @Nullable String email) {

    /** The profile id the cloud service knows this user by: email, then name, then empty. */
    public String profileId() {
        if (email != null && !email.isBlank()) {
            return email;
        }
        if (name != null && !name.isBlank()) {
            return name;
        }
        return "";
    }
}
