package com.glyphforge.classification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glyphforge.api.exceptions.FitException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Label vocabulary plus labelled samples used to train the {@link UiRoleClassifier}.
 * The position of a label in {@code labels} is its numeric class id.
 */
public record TrainingSet(
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("samples") List<TrainingSample> samples
) {

    public static final String DEFAULT_RESOURCE = "/classifier/default-training.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public TrainingSet {
        labels = labels == null ? List.of() : List.copyOf(labels);
        samples = samples == null ? List.of() : List.copyOf(samples);
        for (TrainingSample sample : samples) {
            if (!labels.contains(sample.label())) {
                throw new FitException("Training sample uses undeclared label '" + sample.label() + "'");
            }
        }
    }

    public int labelId(String label) {
        return labels.indexOf(label);
    }

    /**
     * Loads the training set bundled with the library.
     */
    public static TrainingSet defaults() {
        try (InputStream in = TrainingSet.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return MAPPER.readValue(in, TrainingSet.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static TrainingSet fromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, TrainingSet.class);
        }
    }
}
