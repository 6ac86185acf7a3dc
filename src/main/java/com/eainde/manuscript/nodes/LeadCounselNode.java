package com.eainde.manuscript.nodes;

import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.Presentation;
import com.eainde.manuscript.workflow.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Triage: triples that bring vocabulary the thesis does not mention need detailed checking.
 */
@Log4j2
@Component
public class LeadCounselNode implements PipelineNode {

    @Override
    public Stage stage() {
        return Stage.LEAD_COUNSEL;
    }

    @Override
    public void execute(PipelineRun run) {
        Set<String> thesisTokens = tokens(run.getProjectContext().thesis());
        boolean novel = run.getExtraction().triples().stream()
                .flatMap(t -> tokens(t.subject() + " " + t.object()).stream())
                .anyMatch(token -> !thesisTokens.contains(token));
        Presentation presentation = novel ? Presentation.DETAIL : Presentation.SUMMARIZE;
        run.setPresentation(presentation);
        log.info("LEAD_COUNSEL: job {} -> {}", run.getJobId(), presentation);
    }

    static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }
}
