package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.model.SourcePointer;
import com.eainde.manuscript.state.ProjectContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Offline extractor for pre-structured text. Each line of the form
 * <pre>subject | predicate | object [| page [| confidence]]</pre>
 * becomes one triple; every other line is ignored.
 */
@Slf4j
public class DelimitedTripleExtractor implements Extractor {

    @Override
    public ExtractionResult extract(String text, ProjectContext context) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.empty();
        }
        List<ExtractedTriple> triples = new ArrayList<>();
        Set<String> entities = new LinkedHashSet<>();
        for (String line : text.split("\\R")) {
            String[] parts = line.split("\\|");
            if (parts.length < 3) {
                continue;
            }
            String subject = parts[0].trim();
            String predicate = parts[1].trim();
            String object = parts[2].trim();
            if (subject.isEmpty() || predicate.isEmpty() || object.isEmpty()) {
                continue;
            }
            Integer page = parts.length > 3 ? parseInt(parts[3]) : null;
            Double confidence = parts.length > 4 ? parseDouble(parts[4]) : null;
            SourcePointer pointer = new SourcePointer(null, page, null, line.trim());
            triples.add(new ExtractedTriple(subject, predicate, object, confidence, pointer,
                    subject + " " + predicate + " " + object, List.of()));
            entities.add(subject);
            entities.add(object);
        }
        log.debug("Parsed {} delimited triples", triples.size());
        return new ExtractionResult(triples, new ArrayList<>(entities));
    }

    private static Integer parseInt(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
