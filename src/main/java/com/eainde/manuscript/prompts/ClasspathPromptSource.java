package com.eainde.manuscript.prompts;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads {@code prompts/<role>.txt} from the classpath. An optional first line
 * {@code # version: <v>} sets the version and is not part of the prompt text.
 */
@Slf4j
public class ClasspathPromptSource implements PromptSource {

    private static final String VERSION_HEADER = "# version:";

    private final String basePath;

    public ClasspathPromptSource(String basePath) {
        this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
    }

    @Override
    public PromptTemplate load(String role) {
        Resource resource = new ClassPathResource(basePath + role + ".txt");
        if (!resource.exists()) {
            throw new IllegalArgumentException("No prompt for role '" + role + "' under " + basePath);
        }
        try (InputStream in = resource.getInputStream()) {
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            String version = null;
            if (content.startsWith(VERSION_HEADER)) {
                int eol = content.indexOf('\n');
                String header = eol < 0 ? content : content.substring(0, eol);
                version = header.substring(VERSION_HEADER.length()).trim();
                content = eol < 0 ? "" : content.substring(eol + 1);
            }
            log.debug("Loaded prompt {} version {}", role, version);
            return new PromptTemplate(role, version, content.strip());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt for role " + role, e);
        }
    }
}
