package ai.segmap.request;

import ai.segmap.util.Json;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The request signal a consumer sends to have a manifest (re)built.
 *
 * @param type always {@link #TYPE}
 * @param manifestPath path of the manifest to populate
 * @param force rebuild even when the manifest is already populated
 */
@JsonPropertyOrder({"type", "manifestPath", "force"})
public record ManifestRequest(String type, String manifestPath, boolean force) {
    private static final Logger logger = LogManager.getLogger(ManifestRequest.class);

    public static final String TYPE = "segment-manifest-request";

    public static ManifestRequest of(Path manifestPath, boolean force) {
        return new ManifestRequest(TYPE, manifestPath.toString(), force);
    }

    public Path path() {
        return Path.of(manifestPath);
    }

    public String toJsonLine() {
        return Json.toCompactJson(this);
    }

    /**
     * Parses one message. Empty for malformed JSON, a different {@code type}, or a missing or unusable
     * {@code manifestPath}.
     */
    public static Optional<ManifestRequest> parse(String json) {
        try {
            var node = Json.readTree(json);
            if (node == null || !node.isObject()) {
                logger.debug("Ignoring non-object request message: {}", json);
                return Optional.empty();
            }
            if (!TYPE.equals(node.path("type").asText(null))) {
                logger.debug("Ignoring message of type {}", node.path("type"));
                return Optional.empty();
            }
            var pathNode = node.get("manifestPath");
            if (pathNode == null || !pathNode.isTextual() || pathNode.asText().isBlank()) {
                logger.debug("Ignoring request without manifestPath: {}", json);
                return Optional.empty();
            }
            Path.of(pathNode.asText());
            return Optional.of(new ManifestRequest(TYPE, pathNode.asText(), node.path("force").asBoolean(false)));
        } catch (IOException | InvalidPathException e) {
            logger.debug("Ignoring malformed request message: {}", json, e);
            return Optional.empty();
        }
    }
}
