package io.patchbay.git;

import com.google.common.base.Splitter;
import java.util.Locale;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Maps git remote URLs to hosting providers. */
public interface RemoteProviders {
    Logger logger = LogManager.getLogger(RemoteProviders.class);

    String GITHUB = "github";
    String GITLAB = "gitlab";
    String BITBUCKET = "bitbucket";
    String AZURE_DEVOPS = "azure-devops";

    Pattern SEGMENT_SPLIT = Pattern.compile("[/:]+");

    /**
     * Parses a remote URL of the forms
     * {@code https://host/OWNER/REPO.git}, {@code git@host:OWNER/REPO.git}, {@code ssh://git@host/OWNER/REPO}.
     *
     * @return the provider, or null when the URL cannot be parsed or the host is not a known provider
     */
    static @Nullable GitRemoteProvider parse(String remoteName, String remoteUrl) {
        if (remoteUrl.isBlank()) {
            return null;
        }

        String cleaned = remoteUrl.trim().replace('\\', '/');
        if (cleaned.endsWith(".git")) {
            cleaned = cleaned.substring(0, cleaned.length() - 4);
        }

        int protocolIndex = cleaned.indexOf("://");
        if (protocolIndex >= 0) {
            cleaned = cleaned.substring(protocolIndex + 3);
        }

        int atIndex = cleaned.indexOf('@');
        if (atIndex >= 0) {
            cleaned = cleaned.substring(atIndex + 1);
        }

        var segments = Splitter.on(SEGMENT_SPLIT).omitEmptyStrings().splitToList(cleaned);
        if (segments.size() < 3) {
            logger.debug("Remote {} URL {} has too few segments for owner/repo", remoteName, remoteUrl);
            return null;
        }

        String host = segments.get(0).toLowerCase(Locale.ROOT);
        // ssh URLs may carry a port after the host
        int firstPathSegment = 1;
        if (segments.get(1).chars().allMatch(Character::isDigit) && segments.size() >= 4) {
            firstPathSegment = 2;
        }

        String providerId = providerIdForHost(host);
        if (providerId == null) {
            return null;
        }

        String owner = segments.get(firstPathSegment);
        String repo = segments.get(segments.size() - 1);
        return new GitRemoteProvider(providerId, host, owner, owner + "/" + repo, remoteName);
    }

    static @Nullable String providerIdForHost(String host) {
        if (host.equals("github.com") || host.startsWith("github.")) {
            return GITHUB;
        }
        if (host.equals("gitlab.com") || host.startsWith("gitlab.")) {
            return GITLAB;
        }
        if (host.equals("bitbucket.org")) {
            return BITBUCKET;
        }
        if (host.equals("dev.azure.com") || host.endsWith(".visualstudio.com") || host.equals("ssh.dev.azure.com")) {
            return AZURE_DEVOPS;
        }
        return null;
    }
}
