/**
 * Framework-neutral core for declarative query parameters.
 *
 * <p>This module contains only:
 * <ul>
 *   <li>The query string codec and its tri-state single-key lookup</li>
 *   <li>Conversion capabilities between values and query text, with a small registry</li>
 *   <li>The exception hierarchy</li>
 * </ul>
 *
 * <p>Route descriptors and their interpreters live in other modules.
 */
package io.queryparams.core;
