package io.patchbay.git;

import org.eclipse.jgit.api.errors.GitAPIException;

/** Failure reading from or writing to a repository. */
public class GitRepoException extends GitAPIException {

    public GitRepoException(String message) {
        super(message);
    }

    public GitRepoException(String message, Throwable cause) {
        super(message, cause);
    }
}
