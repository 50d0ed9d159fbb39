package io.queryparams.spi;

/**
 * Documentation capability of a combinator.
 */
public interface DocsInterpretable {

    /**
     * Registers this combinator's {@link DocEntry} on {@code docs} and hands the result to {@code next}.
     */
    <R> R document(ActionDocs docs, DocsContinuation<R> next);
}
