package org.stencil.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} distinguishes.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
