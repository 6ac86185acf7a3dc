package com.eainde.manuscript.governance.conflict;

import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.model.ConflictItem;

import java.util.List;

/**
 * Claims that were examined and the conflicts found among them.
 *
 * @param claims       claims from the store merged with the run's own claims
 * @param items        detected conflicts, in deterministic order
 * @param storeFailure message of the claim store failure, {@code null} when loading worked
 */
public record ConflictDetection(List<Claim> claims, List<ConflictItem> items, String storeFailure) {

    public ConflictDetection {
        claims = List.copyOf(claims);
        items = List.copyOf(items);
    }

    public boolean hasConflicts() {
        return !items.isEmpty();
    }
}
