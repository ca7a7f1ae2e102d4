package org.pragmatica.cfg;

import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.GrammarParser;
import org.pragmatica.cfg.parser.BacktrackingParser;
import org.pragmatica.cfg.parser.Parser;
import org.pragmatica.cfg.parser.ParserConfig;
import org.pragmatica.cfg.parser.TableBuild;
import org.pragmatica.cfg.parser.Technique;

import java.util.Optional;

/**
 * Entry point for building context-free grammar parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = CfgParser.fromGrammar("""
 *     E -> E + T | T
 *     T -> T * F | F
 *     F -> ( E ) | id
 *     """, Technique.SLR1);
 *
 * var tree = parser.parse("id + id * id").unwrap();
 * }</pre>
 *
 * <p>Every method throws {@link CfgException} when the grammar is invalid or, where a parser is
 * returned, when the technique's table has conflicts.
 */
public final class CfgParser {
    private CfgParser() {}

    /**
     * Parse grammar notation text.
     */
    public static Grammar grammar(String grammarText) {
        return GrammarParser.parse(grammarText);
    }

    /**
     * Build the technique's table for a grammar. Conflicts are reported, not thrown.
     */
    public static TableBuild build(Grammar grammar, Technique technique) {
        return technique.build(grammar);
    }

    /**
     * Create a table-driven parser from grammar text.
     */
    public static Parser fromGrammar(String grammarText, Technique technique) {
        return fromGrammar(grammarText, technique, ParserConfig.DEFAULT);
    }

    public static Parser fromGrammar(String grammarText, Technique technique, ParserConfig config) {
        return build(grammar(grammarText), technique).parser(config);
    }

    /**
     * Create a backtracking parser over the grammar as written.
     */
    public static Parser backtracking(Grammar grammar) {
        return backtracking(grammar, ParserConfig.DEFAULT);
    }

    public static Parser backtracking(Grammar grammar, ParserConfig config) {
        return BacktrackingParser.create(grammar, config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    public static final class Builder {
        private final String grammarText;
        private Optional<Technique> technique = Optional.empty();
        private boolean trace = ParserConfig.DEFAULT.traceEnabled();
        private int depthLimit = ParserConfig.DEFAULT.backtrackDepthLimit();
        private int stepLimit = ParserConfig.DEFAULT.backtrackStepLimit();

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        /**
         * Table-driven technique; without one the builder produces a backtracking parser.
         */
        public Builder technique(Technique technique) {
            this.technique = Optional.of(technique);
            return this;
        }

        public Builder trace(boolean enabled) {
            this.trace = enabled;
            return this;
        }

        public Builder depthLimit(int limit) {
            this.depthLimit = limit;
            return this;
        }

        public Builder stepLimit(int limit) {
            this.stepLimit = limit;
            return this;
        }

        public Parser build() {
            var config = new ParserConfig(depthLimit, stepLimit, trace);
            var grammar = grammar(grammarText);
            return technique.map(t -> CfgParser.build(grammar, t)
                                                      .parser(config))
                            .orElseGet(() -> backtracking(grammar, config));
        }
    }
}
