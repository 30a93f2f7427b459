package ai.segmap.analyzer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Extracts raw import specifiers from one module's text using Tree-sitter.
 *
 * <p>Collected: the source of every {@code import} / re-exporting {@code export ... from} statement, the string of a
 * TypeScript {@code import x = require('...')} clause, and the first argument of {@code require(...)} and dynamic
 * {@code import(...)} calls. Only plain string literals count; computed specifiers cannot be resolved statically and
 * are skipped.
 */
public class ImportExtractor {
    private static final Logger logger = LogManager.getLogger(ImportExtractor.class);

    private static final char BOM = '\uFEFF';

    private final Map<ModuleLanguage, ThreadLocal<TSParser>> parsers = new EnumMap<>(ModuleLanguage.class);

    public ImportExtractor() {
        for (var language : ModuleLanguage.values()) {
            parsers.put(language, ThreadLocal.withInitial(() -> {
                var parser = new TSParser();
                if (!parser.setLanguage(language.createTSLanguage())) {
                    logger.error("Failed to set language on TSParser for {}", language);
                }
                return parser;
            }));
        }
    }

    /**
     * @param source full text of the module
     * @param file path of the module; only its extension matters
     * @return distinct raw specifiers, empty for non-module files and for files that fail to parse
     */
    public Set<String> extract(String source, Path file) {
        var language = ModuleLanguage.forFile(file);
        if (language.isEmpty()) {
            return Set.of();
        }

        var text = !source.isEmpty() && source.charAt(0) == BOM ? source.substring(1) : source;
        var bytes = text.getBytes(StandardCharsets.UTF_8);

        TSNode root;
        try {
            TSTree tree = parsers.get(language.get()).get().parseString(null, text);
            root = tree.getRootNode();
        } catch (RuntimeException e) {
            logger.debug("Parser failed for {}; treating as having no imports", file, e);
            return Set.of();
        }
        if (root == null || root.isNull()) {
            logger.debug("Parsing produced no root node for {}; treating as having no imports", file);
            return Set.of();
        }
        if (language.get().rejectsSyntaxErrors() && root.hasError()) {
            logger.debug("Syntax errors in {}; treating as having no imports", file);
            return Set.of();
        }

        var specifiers = new LinkedHashSet<String>();
        var pending = new ArrayDeque<TSNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            switch (node.getType()) {
                case "import_statement", "export_statement" ->
                        stringField(node, "source", bytes).ifPresent(specifiers::add);
                case "import_require_clause" -> requireClauseSpecifier(node, bytes).ifPresent(specifiers::add);
                case "call_expression" -> callSpecifier(node, bytes).ifPresent(specifiers::add);
                default -> {}
            }
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                pending.push(node.getNamedChild(i));
            }
        }
        logger.trace("{} raw specifiers in {}: {}", specifiers.size(), file, specifiers);
        return Collections.unmodifiableSet(specifiers);
    }

    /** {@code require('x')} or {@code import('x')} with a literal first argument. */
    private static Optional<String> callSpecifier(TSNode call, byte[] bytes) {
        var callee = call.getChildByFieldName("function");
        if (callee == null || callee.isNull()) {
            return Optional.empty();
        }
        boolean isImport = "import".equals(callee.getType());
        boolean isRequire =
                "identifier".equals(callee.getType()) && "require".equals(textSlice(callee, bytes));
        if (!isImport && !isRequire) {
            return Optional.empty();
        }
        var args = call.getChildByFieldName("arguments");
        if (args == null || args.isNull() || args.getNamedChildCount() == 0) {
            return Optional.empty();
        }
        return stringLiteral(args.getNamedChild(0), bytes);
    }

    /** {@code import x = require('x')}; older grammars have no {@code source} field on the clause. */
    private static Optional<String> requireClauseSpecifier(TSNode clause, byte[] bytes) {
        var viaField = stringField(clause, "source", bytes);
        if (viaField.isPresent()) {
            return viaField;
        }
        for (int i = 0; i < clause.getNamedChildCount(); i++) {
            var child = clause.getNamedChild(i);
            if ("string".equals(child.getType())) {
                return stringLiteral(child, bytes);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> stringField(TSNode node, String field, byte[] bytes) {
        var child = node.getChildByFieldName(field);
        if (child == null || child.isNull()) {
            return Optional.empty();
        }
        return stringLiteral(child, bytes);
    }

    private static Optional<String> stringLiteral(TSNode node, byte[] bytes) {
        if (node == null || node.isNull() || !"string".equals(node.getType())) {
            return Optional.empty();
        }
        var raw = textSlice(node, bytes);
        if (raw.length() < 2) {
            return Optional.empty();
        }
        var value = raw.substring(1, raw.length() - 1);
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static String textSlice(TSNode node, byte[] bytes) {
        int start = node.getStartByte();
        int end = Math.min(node.getEndByte(), bytes.length);
        if (start < 0 || start >= end) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }
}
