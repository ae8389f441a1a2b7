package io.graphlint.model;

/**
 * Reference to a pin on another node of the same graph.
 *
 * @param nodeId  Id of the node owning the pin
 * @param pinName Name of the pin on that node
 */
public record PinRef(String nodeId, String pinName) {

    public PinRef {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be null or blank");
        }
        if (pinName == null || pinName.isBlank()) {
            throw new IllegalArgumentException("pinName cannot be null or blank");
        }
    }
}
