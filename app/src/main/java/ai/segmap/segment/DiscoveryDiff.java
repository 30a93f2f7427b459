package ai.segmap.segment;

import java.util.List;

/**
 * Outcome of comparing two discovery passes.
 *
 * @param current every segment id found by the latest pass, sorted
 * @param removed ids known before but no longer present, sorted
 */
public record DiscoveryDiff(List<String> current, List<String> removed) {
    public DiscoveryDiff {
        current = current.stream().sorted().toList();
        removed = removed.stream().sorted().toList();
    }

    public boolean hasRemovals() {
        return !removed.isEmpty();
    }
}
