/**
 * The frontend package contains the classes that take the parsed
 * statement tree, perform semantic analysis on it (name resolution,
 * variable lifetime tracking, legality checks) and lower it to the
 * primitive statements the execution engine understands.
 */
package exm.scriptc.frontend;
