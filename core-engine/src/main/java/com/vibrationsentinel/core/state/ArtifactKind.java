package com.vibrationsentinel.core.state;

/**
 * Kind tags written into {@link VersionedArtifact#getKind()}.
 */
public final class ArtifactKind {

    public static final String NORMALIZATION_STATS = "normalization-stats";
    public static final String THRESHOLD_STATE = "threshold-state";
    public static final String DRIFT_STATE = "drift-state";
    public static final String AUTOENCODER = "autoencoder";
    public static final String ISOLATION_FOREST = "isolation-forest";
    public static final String LSTM = "lstm";

    private ArtifactKind() {
        // constants only
    }
}
