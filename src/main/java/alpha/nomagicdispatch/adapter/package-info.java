/**
 * Adapters connect an {@link alpha.nomagicdispatch.Engine Engine} to a
 * transport.
 */
package alpha.nomagicdispatch.adapter;
