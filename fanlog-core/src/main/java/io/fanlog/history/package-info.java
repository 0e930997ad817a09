/**
 * Bounded in-memory history of formatted lines.
 */
package io.fanlog.history;
