/**
 * Small shared helpers: argument checks, the attempt-and-discard policy, and the fan-out
 * thread factory.
 */
package io.fanlog.util;
