package com.shading.sgc.model;

/**
 * Directed edge from an output pin to an input pin, stored by node id.
 */
public record Link(int producerId, String producerPin, int consumerId, String consumerPin) {

    @Override
    public String toString() {
        return producerId + "." + producerPin + " -> " + consumerId + "." + consumerPin;
    }
}
