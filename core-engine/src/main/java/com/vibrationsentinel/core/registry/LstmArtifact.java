package com.vibrationsentinel.core.registry;

import com.vibrationsentinel.core.detection.DenseLayer;
import com.vibrationsentinel.core.detection.FeatureLayout;
import com.vibrationsentinel.core.detection.LstmLayer;
import com.vibrationsentinel.core.detection.LstmSequenceModel;
import com.vibrationsentinel.core.detection.TemporalDetector;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of the temporal detector: input feature names and the
 * sequence model.
 */
public class LstmArtifact {

    private List<String> featureNames = new ArrayList<>();
    private List<LstmLayer> recurrent = new ArrayList<>();
    private List<DenseLayer> head = new ArrayList<>();
    private int sequenceLength = 100;

    public LstmArtifact() {
    }

    public LstmArtifact(List<String> featureNames, List<LstmLayer> recurrent, List<DenseLayer> head,
            int sequenceLength) {
        this.featureNames = featureNames;
        this.recurrent = recurrent;
        this.head = head;
        this.sequenceLength = sequenceLength;
    }

    public TemporalDetector toDetector() {
        if (featureNames == null || featureNames.isEmpty()) {
            throw new IllegalArgumentException("LSTM artifact does not name its input features");
        }
        FeatureLayout layout = new FeatureLayout(featureNames);
        LstmSequenceModel model = new LstmSequenceModel(recurrent, head, sequenceLength);
        if (model.inputSize() != layout.size()) {
            throw new IllegalArgumentException("LSTM expects " + model.inputSize()
                    + " inputs but its layout names " + layout.size());
        }
        return new TemporalDetector(layout, model);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public void setFeatureNames(List<String> featureNames) {
        this.featureNames = featureNames;
    }

    public List<LstmLayer> getRecurrent() {
        return recurrent;
    }

    public void setRecurrent(List<LstmLayer> recurrent) {
        this.recurrent = recurrent;
    }

    public List<DenseLayer> getHead() {
        return head;
    }

    public void setHead(List<DenseLayer> head) {
        this.head = head;
    }

    public int getSequenceLength() {
        return sequenceLength;
    }

    public void setSequenceLength(int sequenceLength) {
        this.sequenceLength = sequenceLength;
    }
}
