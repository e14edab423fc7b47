package io.hearthwarrio.veilguard.core.host;

import java.util.List;

/**
 * Receives batches of tree changes, in the order the host recorded them.
 */
@FunctionalInterface
public interface MutationListener {

    void onMutations(List<Mutation> batch);
}
