package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostNode;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

/**
 * Identity-keyed, weakly referenced set of elements that have already been suppressed.
 * <p>
 * An element enters at most once. Entries of reclaimed handles are expunged on every access;
 * entries of elements no longer attached to the document are dropped by {@link #pruneDisconnected()}.
 * <p>
 * This class is not thread-safe.
 */
public final class ProcessedSet {

    private final Set<Key> keys = new HashSet<>();
    private final ReferenceQueue<HostNode> reclaimed = new ReferenceQueue<>();

    /**
     * @param node element
     * @return true if the element was not yet present
     */
    public boolean add(HostNode node) {
        Objects.requireNonNull(node, "node must not be null");
        expunge();
        return keys.add(new Key(node, reclaimed));
    }

    public boolean contains(HostNode node) {
        if (node == null) {
            return false;
        }
        expunge();
        return keys.contains(new Key(node, null));
    }

    public int size() {
        expunge();
        return keys.size();
    }

    /**
     * Drops entries whose element is reclaimed, detached or no longer readable.
     *
     * @return number of removed entries
     */
    public int pruneDisconnected() {
        expunge();
        int removed = 0;
        Iterator<Key> it = keys.iterator();
        while (it.hasNext()) {
            HostNode n = it.next().get();
            if (n == null || !isConnected(n)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private static boolean isConnected(HostNode n) {
        try {
            return n.isConnected();
        } catch (RuntimeException e) {
            return false;
        }
    }

    private void expunge() {
        Reference<? extends HostNode> ref;
        while ((ref = reclaimed.poll()) != null) {
            keys.remove(ref);
        }
    }

    private static final class Key extends WeakReference<HostNode> {
        private final int hash;

        Key(HostNode node, ReferenceQueue<HostNode> queue) {
            super(node, queue);
            this.hash = System.identityHashCode(node);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            HostNode mine = get();
            return mine != null && mine == ((Key) o).get();
        }
    }
}
