package relay.transform;

import relay.model.OutboundPayload;

import java.util.Objects;

/**
 * Output of {@link WatermarkEngine#transform}.
 *
 * @param watermarkApplied true if text or media received a watermark
 * @param fellBack         true if a media transform failed and the original bytes were kept
 */
public record TransformResult(OutboundPayload payload, boolean watermarkApplied, boolean fellBack) {

    public TransformResult {
        Objects.requireNonNull(payload, "payload");
    }
}
