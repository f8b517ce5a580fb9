package org.nowstart.retune.data.dto;

import java.util.List;

/**
 * Finite grid of hyperparameter values. Candidates are addressed by index in row-major order
 * (context length, then sample count, then temperature), so enumeration is stable across runs.
 */
public record SearchSpace(
        List<Integer> contextLengths,
        List<Integer> numSamples,
        List<Double> temperatures
) {

    public SearchSpace {
        contextLengths = requireValues(contextLengths, "contextLengths");
        numSamples = requireValues(numSamples, "numSamples");
        temperatures = requireValues(temperatures, "temperatures");
    }

    public int size() {
        long size = (long) contextLengths.size() * numSamples.size() * temperatures.size();
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("search space too large: " + size);
        }
        return (int) size;
    }

    public Hyperparameters candidateAt(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("candidate index " + index + " outside [0, " + size() + ")");
        }
        int[] sizes = {contextLengths.size(), numSamples.size(), temperatures.size()};
        long[] strides = buildStrides(sizes);
        return new Hyperparameters(
                contextLengths.get(coord(index, strides[0], sizes[0])),
                numSamples.get(coord(index, strides[1], sizes[1])),
                temperatures.get(coord(index, strides[2], sizes[2]))
        );
    }

    private static int coord(long index, long stride, int size) {
        return (int) ((index / stride) % size);
    }

    private static long[] buildStrides(int[] sizes) {
        long[] strides = new long[sizes.length];
        long stride = 1L;
        for (int i = sizes.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= sizes[i];
        }
        return strides;
    }

    private static <T> List<T> requireValues(List<T> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return List.copyOf(values);
    }
}
