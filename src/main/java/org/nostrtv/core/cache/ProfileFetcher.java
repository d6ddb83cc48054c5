package org.nostrtv.core.cache;

import java.util.List;

/**
 * Issues the outbound request for profile metadata. Results come back asynchronously through the
 * normal event stream and land in the cache via {@link ProfileCache#put}.
 */
@FunctionalInterface
public interface ProfileFetcher {
    void fetchProfiles(List<String> pubkeys);
}
