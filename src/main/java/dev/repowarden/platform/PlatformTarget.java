package dev.repowarden.platform;

import dev.repowarden.domain.event.RepositoryEvent;

/**
 * Addresses an issue or pull request on the platform.
 *
 * @param headSha head commit of a pull request, {@code null} for issues and comments
 */
public record PlatformTarget(String repository, int number, String headSha, long installationId) {

    public PlatformTarget {
        if (repository == null || !repository.contains("/"))
            throw new IllegalArgumentException("repository must be owner/name: " + repository);
    }

    public String owner() {
        return repository.substring(0, repository.indexOf('/'));
    }

    public String name() {
        return repository.substring(repository.indexOf('/') + 1);
    }

    public static PlatformTarget of(RepositoryEvent event) {
        String sha = event.pullRequest().map(pr -> pr.headSha()).orElse(null);
        return new PlatformTarget(event.repository(), event.number(), sha, event.installationId());
    }
}
