package org.pragmatica.cfg.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParseTreeNodeTest {
    private static final Symbol E = Symbol.nonterminal("E");
    private static final Symbol L = Symbol.nonterminal("L");
    private static final Symbol ID = Symbol.terminal("id");

    @Test
    void leaves_collectLexemesLeftToRight() {
        var tree = ParseTreeNode.node(E, List.of(ParseTreeNode.leaf(ID, new Token("id", "x", 1)),
                                                 ParseTreeNode.node(L, List.of()),
                                                 ParseTreeNode.leaf(ID, new Token("id", "y", 2))));

        assertEquals(List.of("x", "y"), tree.leaves());
    }

    @Test
    void format_indentsChildrenAndMarksEpsilon() {
        var tree = ParseTreeNode.node(E, List.of(ParseTreeNode.leaf(ID, new Token("id", "x", 1)),
                                                 ParseTreeNode.node(L, List.of())));

        assertEquals("""
                     E
                       id 'x'
                       L -> ε
                     """, tree.format());
    }

    @Test
    void toString_isBracketed() {
        var tree = ParseTreeNode.node(E, List.of(ParseTreeNode.leaf(ID, Token.of("id", 1)),
                                                 ParseTreeNode.node(L, List.of())));

        assertEquals("E(id L())", tree.toString());
    }

    @Test
    void find_searchesPreOrder() {
        var inner = ParseTreeNode.node(L, List.of(ParseTreeNode.leaf(ID, Token.of("id", 1))));
        var tree = ParseTreeNode.node(E, List.of(inner));

        assertEquals(inner, tree.find(node -> node.name().equals("L")).orElseThrow());
        assertTrue(tree.contains("id"));
        assertFalse(tree.contains("F"));
        assertTrue(tree.child(0).child(0).isLeaf());
    }
}
