package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.state.ProjectContext;

/**
 * Turns source text into relation triples. Implementations may throw on timeouts or malformed
 * output; the cartographer stage absorbs those failures.
 */
public interface Extractor {

    ExtractionResult extract(String text, ProjectContext context);
}
