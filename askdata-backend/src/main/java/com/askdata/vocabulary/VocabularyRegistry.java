package com.askdata.vocabulary;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the query vocabulary once at startup.
 *
 * <p>When {@code askdata.vocabulary.path} points at a readable YAML file it replaces the bundled
 * {@code vocabulary/default.yaml}; a missing or invalid file falls back to the bundled copy.
 */
@Component
public class VocabularyRegistry {
    private static final Logger log = LoggerFactory.getLogger(VocabularyRegistry.class);

    @Value("${askdata.vocabulary.path:}")
    private String vocabularyPath;

    private volatile QueryVocabulary.Compiled vocabulary;

    public VocabularyRegistry() {
    }

    VocabularyRegistry(String vocabularyPath) {
        this.vocabularyPath = vocabularyPath;
    }

    @PostConstruct
    public void loadVocabulary() {
        vocabulary = resolveVocabulary();
        log.info("Loaded query vocabulary (operations={}, synonyms={}, source={})",
                vocabulary.operations().size(),
                vocabulary.synonyms().size(),
                vocabularyPath == null || vocabularyPath.isBlank() ? "classpath" : vocabularyPath);
    }

    public QueryVocabulary.Compiled getVocabulary() {
        QueryVocabulary.Compiled current = vocabulary;
        if (current == null) {
            loadVocabulary();
            current = vocabulary;
        }
        return current;
    }

    private QueryVocabulary.Compiled resolveVocabulary() {
        if (vocabularyPath == null || vocabularyPath.isBlank()) {
            return QueryVocabulary.loadDefault();
        }

        Path path = Paths.get(vocabularyPath.trim());
        if (!Files.isReadable(path)) {
            log.warn("Vocabulary file not readable, using bundled default: {}", path);
            return QueryVocabulary.loadDefault();
        }

        try (InputStream in = Files.newInputStream(path)) {
            return QueryVocabulary.load(in);
        } catch (Exception e) {
            log.error("Failed to load vocabulary file, using bundled default: {}", path, e);
            return QueryVocabulary.loadDefault();
        }
    }
}
