package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.analysis.GrammarSets;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.table.Conflict;
import org.pragmatica.cfg.table.ParseTable;

import java.util.List;

/**
 * Everything a technique produced for one grammar.
 *
 * @param grammar the grammar the table was built over: transformed for LL(1), augmented for LR
 * @param sets    Nullable/FIRST/FOLLOW of that grammar
 */
public record TableBuild(Technique technique, Grammar grammar, GrammarSets sets, ParseTable table) {

    public List<Conflict> conflicts() {
        return table.conflicts();
    }

    public boolean isDeterministic() {
        return table.isDeterministic();
    }

    /**
     * @throws CfgException listing every conflict if the table is not deterministic
     */
    public Parser parser(ParserConfig config) {
        return technique.driver(table, config);
    }

    public Parser parser() {
        return parser(ParserConfig.DEFAULT);
    }
}
