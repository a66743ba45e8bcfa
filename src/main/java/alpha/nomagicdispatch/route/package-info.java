/**
 * Routes, and the path patterns they are matched by.
 */
package alpha.nomagicdispatch.route;
