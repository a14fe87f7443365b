package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.error.StateCorruptionException;
import com.vibrationsentinel.core.pipeline.AssetPipeline;
import com.vibrationsentinel.core.pipeline.PipelineComponents;
import com.vibrationsentinel.core.state.ArtifactCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Live pipelines of one task, keyed by asset id.
 *
 * <p>
 * An asset whose checkpointed state fails to restore stays unavailable until
 * the job restarts from repaired or cleared state; it is never rebuilt on
 * bootstrap cuts.
 * </p>
 */
class AssetPipelines {

    private static final Logger LOG = LoggerFactory.getLogger(AssetPipelines.class);

    private final PipelineComponents components;
    private final ArtifactCodec codec;
    private final Map<String, AssetPipeline> live = new HashMap<>();
    private final Map<String, StateCorruptionException> corrupt = new HashMap<>();

    AssetPipelines(PipelineComponents components, ArtifactCodec codec) {
        this.components = Objects.requireNonNull(components, "components must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * @param stored the asset's keyed state, {@code null} for a new asset
     * @return the asset's pipeline, or empty while its state is corrupt
     */
    Optional<AssetPipeline> pipelineFor(String assetId, CheckpointedAssetState stored) {
        AssetPipeline pipeline = live.get(assetId);
        if (pipeline != null) {
            return Optional.of(pipeline);
        }
        StateCorruptionException known = corrupt.get(assetId);
        if (known != null) {
            LOG.error("Asset '{}' has corrupt state ({}); input dropped", assetId, known.getMessage());
            return Optional.empty();
        }
        try {
            pipeline = stored == null
                    ? new AssetPipeline(assetId, components)
                    : AssetPipeline.restore(components, stored.toAssetState(codec));
        } catch (StateCorruptionException e) {
            LOG.error("Asset '{}' cannot be restored; its input is dropped until its state is repaired",
                    assetId, e);
            corrupt.put(assetId, e);
            return Optional.empty();
        }
        live.put(assetId, pipeline);
        return Optional.of(pipeline);
    }

    boolean isCorrupt(String assetId) {
        return corrupt.containsKey(assetId);
    }

    int size() {
        return live.size();
    }
}
