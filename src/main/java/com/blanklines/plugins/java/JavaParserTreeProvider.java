package com.blanklines.plugins.java;

import com.blanklines.api.tree.SourceParseException;
import com.blanklines.api.tree.SyntaxNode;
import com.blanklines.api.tree.SyntaxTree;
import com.blanklines.api.tree.SyntaxTreeProvider;
import com.blanklines.util.LoggerUtil;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Parses Java sources with JavaParser and exposes them as {@link SyntaxTree}s.
 */
public class JavaParserTreeProvider implements SyntaxTreeProvider {
    private static final Logger logger = LoggerUtil.getLogger(JavaParserTreeProvider.class);

    private final ParserConfiguration.LanguageLevel languageLevel;

    public JavaParserTreeProvider() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public JavaParserTreeProvider(ParserConfiguration.LanguageLevel languageLevel) {
        this.languageLevel = languageLevel;
    }

    @Override
    public SyntaxTree parse(String sourceCode) throws SourceParseException {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(languageLevel);

        // JavaParser instances are not thread-safe, one per parse
        JavaParser parser = new JavaParser(configuration);
        ParseResult<CompilationUnit> parseResult = parser.parse(sourceCode);

        if (!parseResult.isSuccessful() || parseResult.getResult().isEmpty()) {
            throw _toException(parseResult);
        }

        return toSyntaxTree(parseResult.getResult().get());
    }

    /**
     * Builds the tree view of an already parsed compilation unit.
     */
    public SyntaxTree toSyntaxTree(CompilationUnit cu) {
        List<SyntaxNode> codeUnits = new ArrayList<>();

        for (Node unit : cu.findAll(Node.class, JavaNodeKinds::isCodeUnit)) {
            if (unit.getRange().isPresent()) {
                codeUnits.add(JavaSyntaxNode.of(unit));
            }
        }

        logger.fine("Found " + codeUnits.size() + " code units");
        return new SyntaxTree(JavaSyntaxNode.of(cu), codeUnits);
    }

    private SourceParseException _toException(ParseResult<CompilationUnit> parseResult) {
        if (parseResult.getProblems().isEmpty()) {
            return new SourceParseException("Unknown error", 1, 1);
        }

        Problem problem = parseResult.getProblems().get(0);
        Optional<Range> range = problem.getLocation().flatMap(location -> location.getBegin().getRange());

        return new SourceParseException(
                problem.getMessage(),
                range.map(r -> r.begin.line).orElse(1),
                range.map(r -> r.begin.column).orElse(1));
    }

    public ParserConfiguration.LanguageLevel getLanguageLevel() {
        return languageLevel;
    }
}
