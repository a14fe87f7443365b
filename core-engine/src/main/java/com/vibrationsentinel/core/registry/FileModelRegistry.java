package com.vibrationsentinel.core.registry;

import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.detection.IsolationDetector;
import com.vibrationsentinel.core.detection.MissingModelDetector;
import com.vibrationsentinel.core.detection.ReconstructionDetector;
import com.vibrationsentinel.core.detection.TemporalDetector;
import com.vibrationsentinel.core.error.StateCorruptionException;
import com.vibrationsentinel.core.normalization.NormalizationStats;
import com.vibrationsentinel.core.state.ArtifactCodec;
import com.vibrationsentinel.core.state.ArtifactKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ModelRegistry} backed by a directory of versioned JSON artifacts.
 *
 * <h3>Layout</h3>
 * <pre>
 * &lt;dir&gt;/normalization-stats.json
 * &lt;dir&gt;/reconstruction.json
 * &lt;dir&gt;/isolation.json
 * &lt;dir&gt;/temporal.json
 * </pre>
 *
 * <p>
 * Corrupt normalization statistics are fatal and propagate. Corrupt or
 * missing detector artifacts only disable that detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class FileModelRegistry implements ModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FileModelRegistry.class);

    public static final String STATS_FILE = "normalization-stats.json";
    public static final String RECONSTRUCTION_FILE = "reconstruction.json";
    public static final String ISOLATION_FILE = "isolation.json";
    public static final String TEMPORAL_FILE = "temporal.json";

    private final Path directory;
    private final ArtifactCodec codec;

    public FileModelRegistry(Path directory) {
        this(directory, new ArtifactCodec());
    }

    public FileModelRegistry(Path directory, ArtifactCodec codec) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Optional<NormalizationStats> normalizationStats() {
        Path file = directory.resolve(STATS_FILE);
        if (!Files.exists(file)) {
            LOG.warn("No normalization statistics at {}", file);
            return Optional.empty();
        }
        return Optional.of(codec.read(file, ArtifactKind.NORMALIZATION_STATS, NormalizationStats.class));
    }

    @Override
    public List<AnomalyDetector> detectors() {
        List<AnomalyDetector> detectors = new ArrayList<>(3);
        detectors.add(load(ReconstructionDetector.NAME, RECONSTRUCTION_FILE,
                () -> codec.read(directory.resolve(RECONSTRUCTION_FILE), ArtifactKind.AUTOENCODER,
                        AutoencoderArtifact.class).toDetector()));
        detectors.add(load(IsolationDetector.NAME, ISOLATION_FILE,
                () -> codec.read(directory.resolve(ISOLATION_FILE), ArtifactKind.ISOLATION_FOREST,
                        IsolationForestArtifact.class).toDetector()));
        detectors.add(load(TemporalDetector.NAME, TEMPORAL_FILE,
                () -> codec.read(directory.resolve(TEMPORAL_FILE), ArtifactKind.LSTM,
                        LstmArtifact.class).toDetector()));
        return Collections.unmodifiableList(detectors);
    }

    private AnomalyDetector load(String name, String fileName, Supplier<AnomalyDetector> loader) {
        Path file = directory.resolve(fileName);
        if (!Files.exists(file)) {
            LOG.warn("Detector '{}' disabled: no artifact at {}", name, file);
            return new MissingModelDetector(name, "artifact not found: " + fileName);
        }
        try {
            AnomalyDetector detector = loader.get();
            LOG.info("Loaded detector '{}' from {}", name, file);
            return detector;
        } catch (StateCorruptionException | IllegalArgumentException e) {
            LOG.warn("Detector '{}' disabled: artifact {} is invalid: {}", name, file, e.getMessage());
            return new MissingModelDetector(name, "invalid artifact: " + e.getMessage());
        }
    }
}
