package com.vibrationsentinel.core.detection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stacked LSTM layers followed by a dense head whose final layer has a
 * single sigmoid output. Only the last hidden state of the top LSTM layer
 * reaches the head.
 */
public final class LstmSequenceModel implements SequenceModel {

    private final List<LstmLayer> recurrent;
    private final List<DenseLayer> head;
    private final int sequenceLength;

    public LstmSequenceModel(List<LstmLayer> recurrent, List<DenseLayer> head, int sequenceLength) {
        Objects.requireNonNull(recurrent, "recurrent layers must not be null");
        Objects.requireNonNull(head, "head layers must not be null");
        if (recurrent.isEmpty() || head.isEmpty()) {
            throw new IllegalArgumentException("Model needs at least one recurrent and one dense layer");
        }
        if (sequenceLength < 1) {
            throw new IllegalArgumentException("sequenceLength must be >= 1, got: " + sequenceLength);
        }
        for (int i = 1; i < recurrent.size(); i++) {
            if (recurrent.get(i).inputSize() != recurrent.get(i - 1).units()) {
                throw new IllegalArgumentException("LSTM layer " + i + " input size mismatch");
            }
        }
        int width = recurrent.get(recurrent.size() - 1).units();
        for (DenseLayer layer : head) {
            if (layer.inputSize() != width) {
                throw new IllegalArgumentException("Dense head input size mismatch: expected " + width
                        + ", got " + layer.inputSize());
            }
            width = layer.outputSize();
        }
        DenseLayer last = head.get(head.size() - 1);
        if (last.outputSize() != 1 || last.getActivation() != Activation.SIGMOID) {
            throw new IllegalArgumentException("Final layer must have a single sigmoid output");
        }
        this.recurrent = Collections.unmodifiableList(new ArrayList<>(recurrent));
        this.head = Collections.unmodifiableList(new ArrayList<>(head));
        this.sequenceLength = sequenceLength;
    }

    public int inputSize() {
        return recurrent.get(0).inputSize();
    }

    @Override
    public int sequenceLength() {
        return sequenceLength;
    }

    @Override
    public double predict(double[][] sequence) {
        double[][] x = sequence;
        for (LstmLayer layer : recurrent) {
            x = layer.forward(x);
        }
        double[] y = x[x.length - 1];
        for (DenseLayer layer : head) {
            y = layer.forward(y);
        }
        return y[0];
    }

    public List<LstmLayer> getRecurrent() {
        return recurrent;
    }

    public List<DenseLayer> getHead() {
        return head;
    }
}
