package com.phillippitts.scribedesk.config.stt;

import com.phillippitts.scribedesk.exception.ModelLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks model directories before a session starts and lists the models available for selection.
 *
 * <p>Validation is structural only (no JNI): the directory must exist, be readable and be
 * non-empty. Missing {@code am/} or {@code conf/} sub-directories are logged, since their layout
 * varies across models; a truly broken model is caught when the engine loads it.
 */
@Component
public class ModelValidationService {

    private static final Logger LOG = LogManager.getLogger(ModelValidationService.class);

    private final VoskConfig vosk;

    public ModelValidationService(VoskConfig vosk) {
        this.vosk = vosk;
    }

    /**
     * Validates a model directory and returns its absolute, normalized path.
     *
     * @param modelPath configured or selected model path
     * @return resolved path
     * @throws ModelLoadException if the directory is missing, unreadable or empty
     */
    public Path validateVoskModel(String modelPath) {
        if (modelPath == null || modelPath.isBlank()) {
            throw new ModelLoadException(String.valueOf(modelPath), "Model path must not be blank");
        }
        Path modelDir = resolve(modelPath);
        if (!Files.isDirectory(modelDir)) {
            throw new ModelLoadException(modelDir.toString());
        }
        if (!Files.isReadable(modelDir)) {
            throw new ModelLoadException(modelDir.toString(), "Model directory is not readable: " + modelDir);
        }
        if (isEmptyDirectory(modelDir)) {
            throw new ModelLoadException(modelDir.toString(), "Model directory is empty: " + modelDir);
        }
        if (!Files.isDirectory(modelDir.resolve("am")) || !Files.isDirectory(modelDir.resolve("conf"))) {
            LOG.warn("Missing expected Vosk model subdirectories (am/, conf/) under: {}", modelDir);
        }
        return modelDir;
    }

    /**
     * Lists selectable models: every non-empty sub-directory of the configured models directory,
     * sorted by name. Returns an empty list when the models directory does not exist.
     */
    public List<Path> listAvailableModels() {
        Path modelsDir = resolve(vosk.modelsDir());
        if (!Files.isDirectory(modelsDir)) {
            LOG.debug("Models directory not found: {}", modelsDir);
            return List.of();
        }
        try (Stream<Path> children = Files.list(modelsDir)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(dir -> !isEmptyDirectory(dir))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list models under: " + modelsDir, e);
        }
    }

    private static boolean isEmptyDirectory(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        } catch (IOException e) {
            LOG.debug("Cannot list {}: {}", dir, e.toString());
            return true;
        }
    }

    private static Path resolve(String pathString) {
        return Paths.get(pathString).toAbsolutePath().normalize();
    }
}
