package com.example.filterengine.access;

import com.example.filterengine.model.SavedFilter;

/**
 * Decides whether a caller may evaluate a filter or read its run history.
 */
public interface FilterAccessPolicy {
    boolean canAccess(CallerContext caller, SavedFilter filter);
}
