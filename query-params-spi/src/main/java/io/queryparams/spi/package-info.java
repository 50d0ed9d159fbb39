/**
 * Route descriptors and the capabilities their combinators provide to interpreters.
 *
 * <p>A {@link io.queryparams.spi.RouteDescriptor} is a chain of {@link io.queryparams.spi.Combinator}s. Each
 * combinator is {@link io.queryparams.spi.ServerInterpretable server-},
 * {@link io.queryparams.spi.ClientInterpretable client-} and
 * {@link io.queryparams.spi.DocsInterpretable docs-interpretable}. The built-in kinds are
 * {@link io.queryparams.spi.QueryParam}, {@link io.queryparams.spi.QueryParams} and
 * {@link io.queryparams.spi.QueryFlag}.
 */
package io.queryparams.spi;
