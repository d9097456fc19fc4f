package io.patchbay.git;

import org.jetbrains.annotations.Nullable;

/**
 * A remote whose host is a known hosting provider.
 *
 * @param id provider id, e.g. {@code github}
 * @param domain host name of the remote
 * @param owner first path segment (user or organization)
 * @param path {@code owner/repo}
 * @param remoteName name of the git remote, e.g. {@code origin}
 */
public record GitRemoteProvider(String id, String domain, String owner, String path, String remoteName) {

    /** Repository name: the segment after the first '/' of {@link #path()}, or the whole path if there is none. */
    public String repositoryName() {
        int slash = path.indexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /** Web URL of an issue or pull request number on this provider, or null if the provider has no such URL. */
    public @Nullable String issueUrl(String number) {
        return switch (id) {
            case RemoteProviders.GITHUB -> "https://" + domain + "/" + path + "/issues/" + number;
            case RemoteProviders.GITLAB -> "https://" + domain + "/" + path + "/-/issues/" + number;
            case RemoteProviders.BITBUCKET -> "https://" + domain + "/" + path + "/issues/" + number;
            default -> null;
        };
    }
}
