package ai.segmap;

import ai.segmap.manifest.Manifest;

/** Callbacks fired on the engine's loop thread after manifests change on disk. */
public interface SegmentListener {
    default void onSegmentBuilt(String segmentId, Manifest manifest) {}

    default void onSegmentRemoved(String segmentId) {}
}
