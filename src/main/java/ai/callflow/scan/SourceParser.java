package ai.callflow.scan;

import java.util.Objects;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Parses one Java source unit. A fresh {@link JavaParser} is used per call,
 * so a single instance may be shared between threads.
 */
public final class SourceParser {

    private final ParserConfiguration configuration;

    public SourceParser() {
        this(ParserConfiguration.LanguageLevel.JAVA_21);
    }

    public SourceParser(ParserConfiguration.LanguageLevel languageLevel) {
        Objects.requireNonNull(languageLevel, "languageLevel");
        this.configuration = new ParserConfiguration().setLanguageLevel(languageLevel);
    }

    public CompilationUnit parse(String source) throws SourceParseException {
        Objects.requireNonNull(source, "source");

        final ParseResult<CompilationUnit> res;
        try {
            res = new JavaParser(configuration).parse(source);
        } catch (RuntimeException ex) {
            throw new SourceParseException("parser failure: "
                    + ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
        }

        final var cuOpt = res.getResult();
        if (!res.getProblems().isEmpty() || cuOpt.isEmpty()) {
            final String msg = res.getProblems().isEmpty()
                    ? "no compilation unit produced"
                    : res.getProblems().get(0).getMessage();
            throw new SourceParseException("failed to parse source -> " + msg, res.getProblems().size());
        }
        return cuOpt.get();
    }
}
