/**
 * Small applications, each runnable with a {@code main} method.
 */
package alpha.nomagicdispatch.examples;
