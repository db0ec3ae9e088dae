package com.example.filterengine.access;

import com.example.filterengine.model.SavedFilter;
import com.example.filterengine.model.Visibility;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Owner always; team members for team filters; everyone for public ones.
 */
@Component
public class VisibilityAccessPolicy implements FilterAccessPolicy {

    @Override
    public boolean canAccess(CallerContext caller, SavedFilter filter) {
        if (Objects.equals(filter.getOwnerId(), caller.getUserId())) {
            return true;
        }
        switch (Visibility.fromWire(filter.getVisibility())) {
            case PUBLIC:
                return true;
            case TEAM:
                return filter.getTeamId() != null && filter.getTeamId().equals(caller.getTeamId());
            default:
                return false;
        }
    }
}
