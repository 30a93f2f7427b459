package ai.segmap.manifest;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Per-file manifest entry.
 *
 * @param imports project-root-relative POSIX paths of imported closure members, sorted
 * @param lines line count of the file
 */
@JsonPropertyOrder({"imports", "lines"})
public record ManifestFile(List<String> imports, int lines) {
    public ManifestFile {
        imports = imports == null ? List.of() : List.copyOf(imports);
    }
}
