package com.athena.canaryservice.registry;

import com.athena.canaryservice.exception.ModelLoadException;
import com.athena.canaryservice.model.LogisticRegressionModel;
import com.athena.canaryservice.model.ModelArtifact;
import com.athena.canaryservice.model.ModelHandle;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads model artifacts from the filesystem.
 * Every call reads the file again so a deploy always validates the artifact as it is now.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelRegistry {

    private final ObjectMapper objectMapper;

    public ModelHandle load(String path) {
        if (path == null || path.isBlank()) {
            throw new ModelLoadException(path, "Model path must not be blank", false);
        }

        Path file;
        try {
            file = Path.of(path);
        } catch (InvalidPathException e) {
            throw new ModelLoadException(path, "Invalid model path: " + path, e);
        }
        if (!Files.isRegularFile(file)) {
            throw new ModelLoadException(path, "Model file not found: " + path, true);
        }

        log.info("Loading model from {}", path);
        long start = System.nanoTime();

        ModelArtifact artifact;
        try {
            artifact = objectMapper.readValue(file.toFile(), ModelArtifact.class);
        } catch (JsonProcessingException e) {
            throw new ModelLoadException(path, "Failed to load model: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ModelLoadException(path, "Failed to read model: " + e.getMessage(), e);
        }

        LogisticRegressionModel model = toModel(path, artifact);
        log.info("Model {} loaded from {} in {}ms", model.getName(), path,
                String.format("%.2f", (System.nanoTime() - start) / 1_000_000.0));
        return new ModelHandle(path, model);
    }

    private LogisticRegressionModel toModel(String path, ModelArtifact artifact) {
        if (artifact == null) {
            throw new ModelLoadException(path, "Model artifact is empty: " + path, false);
        }
        List<Double> coefficients = artifact.getCoefficients();
        if (coefficients == null || coefficients.isEmpty()) {
            throw new ModelLoadException(path, "Model artifact has no coefficients: " + path, false);
        }
        if (artifact.getIntercept() == null || !Double.isFinite(artifact.getIntercept())) {
            throw new ModelLoadException(path, "Model artifact has no finite intercept: " + path, false);
        }

        double[] weights = new double[coefficients.size()];
        for (int i = 0; i < weights.length; i++) {
            Double c = coefficients.get(i);
            if (c == null || !Double.isFinite(c)) {
                throw new ModelLoadException(path, "Coefficient " + i + " is not a finite number: " + path, false);
            }
            weights[i] = c;
        }

        String name = artifact.getName() != null ? artifact.getName() : Path.of(path).getFileName().toString();
        if (artifact.getVersion() != null) {
            name = name + ":" + artifact.getVersion();
        }
        return new LogisticRegressionModel(name, artifact.getIntercept(), weights);
    }
}
