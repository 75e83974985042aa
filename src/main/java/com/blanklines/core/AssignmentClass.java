package com.blanklines.core;

/**
 * Two-way partition of node kinds used by the spacing rules.
 */
public enum AssignmentClass {
    ASSIGNMENT_LIKE,
    OTHER
}
