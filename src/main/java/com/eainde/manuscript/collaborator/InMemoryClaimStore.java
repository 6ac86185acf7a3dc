package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.Claim;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Claim store kept in process memory. Claims are deduplicated per project by claim id.
 */
@Component
public class InMemoryClaimStore implements ClaimStore {

    private record StoredClaim(String ingestionId, String jobId, Claim claim) {
    }

    private final Map<String, Map<String, StoredClaim>> byProject = new ConcurrentHashMap<>();

    @Override
    public List<Claim> load(String projectId, String ingestionId, String jobId) {
        Map<String, StoredClaim> claims = byProject.get(projectId);
        if (claims == null) {
            return List.of();
        }
        List<Claim> result = new ArrayList<>();
        for (StoredClaim stored : claims.values()) {
            if (ingestionId != null && !Objects.equals(ingestionId, stored.ingestionId())) {
                continue;
            }
            if (jobId != null && !Objects.equals(jobId, stored.jobId())) {
                continue;
            }
            result.add(stored.claim());
        }
        return result;
    }

    @Override
    public void save(String projectId, String ingestionId, String jobId, List<Claim> claims) {
        Map<String, StoredClaim> project = byProject.computeIfAbsent(projectId, k -> new ConcurrentHashMap<>());
        for (Claim claim : claims) {
            project.put(claim.claimId(), new StoredClaim(ingestionId, jobId, claim));
        }
    }
}
