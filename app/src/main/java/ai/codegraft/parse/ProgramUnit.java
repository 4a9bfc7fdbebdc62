package ai.codegraft.parse;

import static ai.codegraft.parse.PythonNodeTypes.COMMENT;
import static ai.codegraft.parse.PythonNodeTypes.ERROR;

import ai.codegraft.ParseFailureException;
import ai.codegraft.api.LineRange;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * An immutable parse of one Python file. The tree's leaves point into the untouched source text, so printing an
 * unmodified unit is returning {@link #text()}. Transforms never mutate a unit: they compute {@link SourceEdit}s and
 * obtain a new unit through {@link #edit(List)}.
 */
public final class ProgramUnit {
    private static final Logger log = LogManager.getLogger(ProgramUnit.class);

    // TSParser is not thread-safe; one instance per thread.
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return parser;
    });

    private final SourceContent content;
    // Held so the native tree outlives every node handed out from it.
    private final TSTree tree;
    private final TSNode root;

    private ProgramUnit(SourceContent content, TSTree tree) {
        this.content = content;
        this.tree = tree;
        this.root = tree.getRootNode();
    }

    /**
     * Parses Python source text.
     *
     * @throws ParseFailureException when the tree contains syntax errors
     */
    public static ProgramUnit parse(String text) throws ParseFailureException {
        var tree = PARSER.get().parseString(null, text);
        var unit = new ProgramUnit(SourceContent.of(text), tree);
        if (unit.root.hasError()) {
            int line = unit.firstErrorLine();
            throw new ParseFailureException("Syntax error at line " + line, line);
        }
        return unit;
    }

    /** Parses, logging and swallowing the failure into an empty result. */
    public static Optional<ProgramUnit> tryParse(String text, String what) {
        try {
            return Optional.of(parse(text));
        } catch (ParseFailureException e) {
            log.warn("{} in {}: {}", e.kind(), what, e.getMessage());
            return Optional.empty();
        }
    }

    private int firstErrorLine() {
        var errorNode = AstTraversalUtils.findNodeRecursive(root, n -> ERROR.equals(n.getType()) || n.isMissing());
        return errorNode == null ? 0 : errorNode.getStartPoint().getRow() + 1;
    }

    /** Applies the edits to this unit's text and parses the result. */
    public ProgramUnit edit(List<SourceEdit> edits) throws ParseFailureException {
        if (edits.isEmpty()) {
            return this;
        }
        return parse(SourceEdit.applyAll(content, edits));
    }

    public String text() {
        return content.text();
    }

    public SourceContent content() {
        return content;
    }

    public TSNode root() {
        return root;
    }

    /** Module-level statements in source order, comments excluded. */
    public List<TSNode> topLevelStatements() {
        return AstTraversalUtils.namedChildren(root).stream()
                .filter(n -> !COMMENT.equals(n.getType()))
                .collect(Collectors.toList());
    }

    public String textOf(TSNode node) {
        return content.substringFrom(node);
    }

    /** 1-based line on which the node starts. */
    public int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based line on which the node's last character sits. */
    public int endLine(TSNode node) {
        var end = node.getEndPoint();
        if (end.getColumn() == 0 && end.getRow() > node.getStartPoint().getRow()) {
            return end.getRow();
        }
        return end.getRow() + 1;
    }

    public LineRange lineRange(TSNode node) {
        return new LineRange(startLine(node), endLine(node));
    }

    /** The full lines the node occupies, terminators included. */
    public String linesOf(TSNode node) {
        return content.lines(startLine(node), endLine(node));
    }

    /** Byte offset where the node's first line starts. */
    public int lineStartByte(TSNode node) {
        return content.rowStartByte(node.getStartPoint().getRow());
    }

    /** Byte offset just past the terminator of the node's last line. */
    public int lineEndByte(TSNode node) {
        return content.rowEndByte(endLine(node) - 1);
    }

    /** Leading whitespace of the line the node starts on. */
    public String indentationOf(TSNode node) {
        var line = content.lines(startLine(node), startLine(node));
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    public String newline() {
        return content.newline();
    }

    /**
     * Where code goes that must precede every statement: before the first statement, or after a leading module
     * docstring. Leading comments (shebang, license header) stay on top.
     */
    public int bodyStartByte() {
        var statements = topLevelStatements();
        if (statements.isEmpty()) {
            return content.byteLength();
        }
        var first = statements.get(0);
        return PythonSyntax.isDocstring(first) ? lineEndByte(first) : lineStartByte(first);
    }

    /** True when text inserted at {@code offset} would be glued onto an unterminated last line. */
    public boolean needsLineBreakAt(int offset) {
        return offset > 0 && offset == content.byteLength() && !content.endsWithNewline();
    }
}
