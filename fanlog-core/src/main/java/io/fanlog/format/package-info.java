/**
 * Message formatting: payload rendering ({@link io.fanlog.format.MessageFormatter}) and
 * timestamp pattern composition ({@link io.fanlog.format.TimePatternBuilder}).
 */
package io.fanlog.format;
