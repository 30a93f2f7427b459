package ai.segmap.segment;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bidirectional membership between files and segments. The two maps are kept exact inverses of each other: a file
 * maps to a segment iff that segment's file set contains the file. Not thread-safe; owned by the engine's event loop.
 */
public class SegmentIndex {
    private final Map<Path, Set<String>> fileToSegments = new HashMap<>();
    private final Map<String, Set<Path>> segmentToFiles = new HashMap<>();

    /** Clears the segment's previous membership, then records {@code files} as its members. */
    public void replaceMembership(String segmentId, Collection<Path> files) {
        clearMembership(segmentId);
        var members = new HashSet<>(files);
        segmentToFiles.put(segmentId, members);
        for (var file : members) {
            fileToSegments.computeIfAbsent(file, k -> new HashSet<>()).add(segmentId);
        }
    }

    public void clearMembership(String segmentId) {
        var previous = segmentToFiles.remove(segmentId);
        if (previous == null) {
            return;
        }
        for (var file : previous) {
            var segments = fileToSegments.get(file);
            if (segments == null) {
                continue;
            }
            segments.remove(segmentId);
            if (segments.isEmpty()) {
                fileToSegments.remove(file);
            }
        }
    }

    public Set<String> segmentsOf(Path file) {
        var segments = fileToSegments.get(file);
        return segments == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(segments));
    }

    public Set<Path> filesOf(String segmentId) {
        var files = segmentToFiles.get(segmentId);
        return files == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(files));
    }

    public boolean isTracked(String segmentId) {
        return segmentToFiles.containsKey(segmentId);
    }

    /** Distinct segments containing any of {@code files}, sorted by id. */
    public List<String> impactedSegments(Collection<Path> files) {
        var impacted = new TreeSet<String>();
        for (var file : files) {
            var segments = fileToSegments.get(file);
            if (segments != null) {
                impacted.addAll(segments);
            }
        }
        return List.copyOf(impacted);
    }

    int trackedFileCount() {
        return fileToSegments.size();
    }
}
