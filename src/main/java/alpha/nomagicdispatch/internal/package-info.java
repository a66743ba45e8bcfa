/**
 * The one and only library-provided engine implementation.<p>
 * 
 * The only public type in this package is {@link
 * alpha.nomagicdispatch.internal.DefaultEngine}, which is used by the {@link
 * alpha.nomagicdispatch.Engine} interface as the default implementation. All
 * other types in this package can therefore be regarded as an implementation
 * detail.<p>
 * 
 * Similar to types found in other packages, implementations of the API provided
 * by this package also use the "Default" name-prefix.
 */
package alpha.nomagicdispatch.internal;
