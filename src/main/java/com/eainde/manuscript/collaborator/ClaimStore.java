package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.Claim;

import java.util.List;

/**
 * Project-scoped claim storage.
 */
public interface ClaimStore {

    /**
     * @param projectId   required project scope
     * @param ingestionId optional narrowing to one ingestion batch
     * @param jobId       optional narrowing to one job
     */
    List<Claim> load(String projectId, String ingestionId, String jobId);

    void save(String projectId, String ingestionId, String jobId, List<Claim> claims);
}
