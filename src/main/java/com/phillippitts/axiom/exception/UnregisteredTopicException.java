package com.phillippitts.axiom.exception;

/**
 * Thrown when an event is published to a topic that no publisher has registered for,
 * or when the event carries no topic at all.
 */
public class UnregisteredTopicException extends AxiomException {

    private final String topic;

    public UnregisteredTopicException(String topic) {
        super(ErrorCode.BUS_UNREGISTERED_TOPIC, topic == null
                ? "Event has no topic"
                : "No publisher registered for topic: " + topic);
        this.topic = topic;
    }

    /**
     * Returns the offending topic, or {@code null} when the event had none.
     */
    public String getTopic() {
        return topic;
    }
}
