package com.flagship.member_payments.document;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the generator for a job kind.
 */
@Component
public class DocumentGenerators {

    private final Map<JobKind, DocumentGenerator> generators = new EnumMap<>(JobKind.class);

    public DocumentGenerators(List<DocumentGenerator> documentGenerators) {
        for (DocumentGenerator generator : documentGenerators) {
            DocumentGenerator previous = generators.put(generator.kind(), generator);
            if (previous != null) {
                throw new IllegalStateException("Two generators registered for " + generator.kind());
            }
        }
    }

    public DocumentGenerator forKind(JobKind kind) {
        DocumentGenerator generator = generators.get(kind);
        if (generator == null) {
            throw new IllegalStateException("No generator registered for " + kind);
        }
        return generator;
    }
}
