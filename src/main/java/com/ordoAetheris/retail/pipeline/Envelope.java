package com.ordoAetheris.retail.pipeline;

/**
 * Queue slot used by the pipeline: either a payload or the end-of-stream marker.
 *
 * <p>The marker is a tag, not a special payload value, so no payload can be mistaken
 * for it, including a payload that is itself an envelope.
 *
 * @param <T> payload type
 */
public final class Envelope<T> {

    private final T value;
    private final boolean end;

    private Envelope(T value, boolean end) {
        this.value = value;
        this.end = end;
    }

    public static <T> Envelope<T> of(T value) {
        return new Envelope<>(value, false);
    }

    public static <T> Envelope<T> end() {
        return new Envelope<>(null, true);
    }

    public boolean isEnd() {
        return end;
    }

    /**
     * @throws IllegalStateException for the end marker, which carries no payload
     */
    public T value() {
        if (end) throw new IllegalStateException("end marker has no value");
        return value;
    }

    @Override
    public String toString() {
        return end ? "Envelope[END]" : "Envelope[" + value + "]";
    }
}
