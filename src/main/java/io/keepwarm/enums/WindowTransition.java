package io.keepwarm.enums;

/**
 * Direction of a daily active window change observed between two ticks.
 */
public enum WindowTransition {
    OPENED,
    CLOSED
}
