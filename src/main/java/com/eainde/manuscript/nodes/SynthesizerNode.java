package com.eainde.manuscript.nodes;

import com.eainde.manuscript.collaborator.Drafter;
import com.eainde.manuscript.collaborator.PromptAware;
import com.eainde.manuscript.governance.GovernanceViolationException;
import com.eainde.manuscript.governance.citation.CitationIntegrity;
import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.model.ManuscriptBlock;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drafts the manuscript from the triples and binds every block to the claims it cites.
 */
@Log4j2
@Component
public class SynthesizerNode implements PipelineNode {

    private static final TypeReference<List<ManuscriptBlock>> BLOCK_LIST = new TypeReference<>() {
    };

    private final Drafter drafter;
    private final PromptRegistry prompts;
    private final ObjectMapper objectMapper;

    public SynthesizerNode(Drafter drafter, PromptRegistry prompts, ObjectMapper objectMapper) {
        this.drafter = drafter;
        this.prompts = prompts;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stage stage() {
        return Stage.SYNTHESIZER;
    }

    @Override
    public void execute(PipelineRun run) {
        List<ExtractedTriple> triples = run.getExtraction().triples();
        List<String> citations = new ArrayList<>();
        for (ExtractedTriple triple : triples) {
            citations.add(Claim.fromTriple(triple, run.getDocHash(), run.getIngestionId()).claimId());
        }

        String draft;
        try {
            draft = drafter.draft(triples, citations, run.getRigor());
        } catch (RuntimeException e) {
            log.warn("SYNTHESIZER: drafter failed for job {}: {}", run.getJobId(), e.getMessage());
            run.forceFailure("Drafter failed: " + e.getMessage());
            return;
        }
        if (drafter instanceof PromptAware aware) {
            run.recordPrompt(stage().wireName(), prompts.use(aware.promptRole()));
        }
        if (draft == null || draft.isBlank()) {
            draft = "Synthesized summary: processed " + triples.size() + " triples.";
        }
        run.setSynthesis(draft);

        List<ManuscriptBlock> blocks = toBlocks(run.getJobId(), draft).stream()
                .map(SynthesizerNode::bindCitations)
                .toList();
        run.setManuscriptBlocks(new ArrayList<>(blocks));

        Set<String> known = run.getClaims().stream().map(Claim::claimId).collect(Collectors.toSet());
        List<String> problems = CitationIntegrity.validate(blocks, known, run.conservative());
        if (!problems.isEmpty()) {
            if (run.conservative()) {
                throw new GovernanceViolationException("citation", "Citation integrity validation failed", problems);
            }
            problems.forEach(run::addWarning);
        }
        log.info("SYNTHESIZER: job {} drafted {} block(s) from {} triples", run.getJobId(), blocks.size(),
                triples.size());
    }

    private List<ManuscriptBlock> toBlocks(String jobId, String draft) {
        String trimmed = draft.trim();
        if (trimmed.startsWith("[")) {
            try {
                List<ManuscriptBlock> parsed = objectMapper.readValue(trimmed, BLOCK_LIST);
                if (!parsed.isEmpty()) {
                    return parsed;
                }
            } catch (JsonProcessingException e) {
                log.debug("SYNTHESIZER: draft is not a block array, keeping it as one block: {}", e.getOriginalMessage());
            }
        }
        return List.of(new ManuscriptBlock("block_" + jobId + "_0", null, null, draft, List.of()));
    }

    private static ManuscriptBlock bindCitations(ManuscriptBlock block) {
        Set<String> ids = new LinkedHashSet<>(block.claimIds());
        ids.addAll(CitationIntegrity.extractClaimIds(block.text()));
        return block.withClaimIds(new ArrayList<>(ids));
    }
}
