package io.intellixity.tally.expr;

/**
 * Node of the dialect-neutral expression tree produced by the compilers.\n
 * Dialects lower it to SQL text; nothing in this tree is SQL-specific.\n
 */
public interface Expr {
}
