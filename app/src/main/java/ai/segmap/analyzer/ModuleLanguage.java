package ai.segmap.analyzer;

import ai.segmap.util.FileUtil;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

/** Source module kinds the import extractor parses, keyed by file extension. */
public enum ModuleLanguage {
    TYPESCRIPT(Set.of(".ts"), true),
    // TSX goes through the TypeScript grammar; JSX bodies recover as error nodes, so errors are tolerated
    TSX(Set.of(".tsx"), false),
    JAVASCRIPT(Set.of(".js", ".jsx", ".mjs", ".cjs"), true);

    private final Set<String> extensions;
    private final boolean rejectsSyntaxErrors;

    ModuleLanguage(Set<String> extensions, boolean rejectsSyntaxErrors) {
        this.extensions = extensions;
        this.rejectsSyntaxErrors = rejectsSyntaxErrors;
    }

    /** When true, a tree whose root reports a syntax error counts as a parse failure. */
    public boolean rejectsSyntaxErrors() {
        return rejectsSyntaxErrors;
    }

    TSLanguage createTSLanguage() {
        return switch (this) {
            case TYPESCRIPT, TSX -> new TreeSitterTypescript();
            case JAVASCRIPT -> new TreeSitterJavascript();
        };
    }

    public static Optional<ModuleLanguage> forFile(Path file) {
        var ext = FileUtil.extension(file);
        for (var language : values()) {
            if (language.extensions.contains(ext)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
