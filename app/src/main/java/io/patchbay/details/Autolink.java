package io.patchbay.details;

/** An issue or pull request reference found in a commit message, e.g. {@code #123}, with its web URL. */
public record Autolink(String id, String url) {}
