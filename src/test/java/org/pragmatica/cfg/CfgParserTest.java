package org.pragmatica.cfg;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.DepthExceededError;
import org.pragmatica.cfg.error.GrammarError;
import org.pragmatica.cfg.error.TableConflictError;
import org.pragmatica.cfg.parser.Technique;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CfgParserTest {

    @Test
    void fromGrammar_slr1_parsesExpression() {
        var parser = CfgParser.fromGrammar(SampleGrammars.EXPRESSIONS, Technique.SLR1);

        var tree = parser.parse("id * ( id + id )").unwrap();

        assertEquals(List.of("id", "*", "(", "id", "+", "id", ")"), tree.leaves());
    }

    @Test
    void fromGrammar_ll1_transformsLeftRecursiveGrammar() {
        var parser = CfgParser.fromGrammar(SampleGrammars.EXPRESSIONS, Technique.LL1);

        var tree = parser.parse("id + id").unwrap();

        assertTrue(tree.contains("E'"));
    }

    @Test
    void fromGrammar_conflictingGrammar_throws() {
        var ex = assertThrows(CfgException.class, () -> CfgParser.fromGrammar(SampleGrammars.DANGLING_ELSE, Technique.SLR1));

        assertInstanceOf(TableConflictError.class, ex.error());
    }

    @Test
    void fromGrammar_malformedText_throws() {
        var ex = assertThrows(CfgException.class, () -> CfgParser.fromGrammar("E => x", Technique.LL1));

        assertInstanceOf(GrammarError.MalformedNotation.class, ex.error());
    }

    @Test
    void build_reportsConflictsForInspection() {
        var build = CfgParser.build(CfgParser.grammar(SampleGrammars.DANGLING_ELSE), Technique.LL1);

        assertEquals(1, build.conflicts().size());
        assertTrue(build.conflicts().get(0).describe().contains("S'"));
    }

    @Test
    void backtracking_handlesNonLl1Grammar() {
        var parser = CfgParser.backtracking(CfgParser.grammar(SampleGrammars.DANGLING_ELSE));

        var tree = parser.parse("i b t i b t a e a").unwrap();

        assertEquals("S", tree.name());
        assertEquals(9, tree.leaves().size());
    }

    @Test
    void builder_withoutTechnique_buildsBacktrackingParser() {
        var parser = CfgParser.builder(SampleGrammars.EXPRESSIONS)
                              .depthLimit(16)
                              .build();

        var error = assertInstanceOf(DepthExceededError.class, parser.parse("id").failure().orElseThrow());
        assertEquals(16, error.limit());
    }

    @Test
    void builder_withTechniqueAndTrace_recordsTrace() {
        var parser = CfgParser.builder(SampleGrammars.LISTS)
                              .technique(Technique.LR0)
                              .trace(true)
                              .build();

        var outcome = parser.parse("x");

        assertTrue(outcome.isAccepted());
        assertFalse(outcome.trace().isEmpty());
    }

    @Test
    void builder_invalidLimit_isRejected() {
        var builder = CfgParser.builder(SampleGrammars.LISTS).stepLimit(0);

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
