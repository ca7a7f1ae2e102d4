package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.analysis.SetSolver;
import org.pragmatica.cfg.automaton.LrAutomatonBuilder;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.table.Ll1Table;
import org.pragmatica.cfg.table.Ll1TableBuilder;
import org.pragmatica.cfg.table.LrMode;
import org.pragmatica.cfg.table.LrTable;
import org.pragmatica.cfg.table.LrTableBuilder;
import org.pragmatica.cfg.table.ParseTable;
import org.pragmatica.cfg.transform.GrammarTransformer;
import org.pragmatica.cfg.tree.Token;

import java.util.List;

/**
 * Table-driven parsing techniques.
 *
 * <p>{@link #LL1} builds over the grammar after left-recursion elimination and left factoring;
 * the LR techniques build over the grammar as written, augmented with a fresh start symbol.
 */
public enum Technique {
    LL1 {
        @Override
        public TableBuild build(Grammar grammar) {
            var prepared = GrammarTransformer.prepareForLl1(grammar);
            var sets = SetSolver.solve(prepared);
            return new TableBuild(this, prepared, sets, Ll1TableBuilder.build(prepared, sets));
        }

        @Override
        public Parser driver(ParseTable table, ParserConfig config) {
            if (table instanceof Ll1Table ll1) {
                return Ll1Driver.create(ll1, config);
            }
            throw mismatch(table);
        }
    },
    LR0 {
        @Override
        public TableBuild build(Grammar grammar) {
            return buildLr(this, grammar, LrMode.LR0);
        }

        @Override
        public Parser driver(ParseTable table, ParserConfig config) {
            return lrDriver(this, table, config);
        }
    },
    SLR1 {
        @Override
        public TableBuild build(Grammar grammar) {
            return buildLr(this, grammar, LrMode.SLR1);
        }

        @Override
        public Parser driver(ParseTable table, ParserConfig config) {
            return lrDriver(this, table, config);
        }
    };

    /**
     * Build the table for the grammar. Conflicts do not fail the build; they are reported in the result.
     *
     * @throws CfgException if the grammar cannot be transformed
     */
    public abstract TableBuild build(Grammar grammar);

    /**
     * Driver for a table built by this technique.
     *
     * @throws CfgException             if the table has conflicts
     * @throws IllegalArgumentException if the table was built by another technique
     */
    public abstract Parser driver(ParseTable table, ParserConfig config);

    public ParseOutcome run(ParseTable table, List<Token> tokens, ParserConfig config) {
        return driver(table, config).parse(tokens);
    }

    private static TableBuild buildLr(Technique technique, Grammar grammar, LrMode mode) {
        var automaton = LrAutomatonBuilder.build(grammar);
        var sets = SetSolver.solve(automaton.grammar());
        return new TableBuild(technique, automaton.grammar(), sets, LrTableBuilder.build(automaton, sets, mode));
    }

    private static Parser lrDriver(Technique technique, ParseTable table, ParserConfig config) {
        if (table instanceof LrTable lr && lr.mode()
                                             .name()
                                             .equals(technique.name())) {
            return LrDriver.create(lr, config);
        }
        throw mismatch(table);
    }

    private static IllegalArgumentException mismatch(ParseTable table) {
        return new IllegalArgumentException("Table of type " + table.getClass()
                                                                    .getSimpleName() + " was not built by this technique");
    }
}
