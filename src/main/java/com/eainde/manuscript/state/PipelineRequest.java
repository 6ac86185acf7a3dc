package com.eainde.manuscript.state;

import com.eainde.manuscript.model.TableData;

import java.util.List;

/**
 * Everything needed to submit a run.
 *
 * @param jobId       job id, generated when {@code null}
 * @param threadId    checkpoint key, generated when {@code null}
 * @param projectId   owning project
 * @param ingestionId ingestion batch the text belongs to, may be {@code null}
 * @param rawText     extracted document text
 * @param docHash     hash of the source document, computed from the text when {@code null}
 * @param formula     formula for the logician, may be {@code null}
 * @param rigor       governance mode, project default when {@code null}
 * @param context     thesis and research questions
 * @param tables      tables to govern and register
 */
public record PipelineRequest(
        String jobId,
        String threadId,
        String projectId,
        String ingestionId,
        String rawText,
        String docHash,
        String formula,
        RigorLevel rigor,
        ProjectContext context,
        List<TableData> tables
) {

    public PipelineRequest {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("PipelineRequest requires a project_id");
        }
        context = context == null ? ProjectContext.empty() : context;
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public static PipelineRequest of(String projectId, String rawText, RigorLevel rigor) {
        return new PipelineRequest(null, null, projectId, null, rawText, null, null, rigor, null, List.of());
    }
}
