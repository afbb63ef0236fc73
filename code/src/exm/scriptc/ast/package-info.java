/**
 * Statement and expression trees handed over by the parser and rewritten
 * by the analyzer.  Nodes are immutable: the analyzer builds new nodes
 * rather than patching the ones it was given.
 */
package exm.scriptc.ast;
