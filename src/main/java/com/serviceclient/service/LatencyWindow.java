package com.serviceclient.service;

import java.util.Arrays;

class LatencyWindow {
    private final double[] samples;
    private int next;
    private int size;

    LatencyWindow(int capacity) {
        this.samples = new double[capacity];
    }

    synchronized void add(double latency) {
        samples[next] = latency;
        next = (next + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    synchronized double[] toArray() {
        double[] copy = new double[size];
        int start = size < samples.length ? 0 : next;
        for (int i = 0; i < size; i++) {
            copy[i] = samples[(start + i) % samples.length];
        }
        return copy;
    }

    synchronized void clear() {
        Arrays.fill(samples, 0);
        next = 0;
        size = 0;
    }

    synchronized int size() {
        return size;
    }
}
