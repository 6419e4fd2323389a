package relay.store;

import relay.ConfigValidationException;
import relay.model.DestinationConfig;
import relay.model.WatermarkConfig;
import relay.transform.WatermarkColors;
import relay.webhook.WebhookUrlPolicy;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Checks a destination before it is stored. The first problem found is reported as a
 * {@link ConfigValidationException} naming the field.
 */
public final class DestinationConfigValidator {
    /** Chat ids are numeric, usually negative; the column holding them is 64 wide. */
    private static final Pattern DESTINATION_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final WebhookUrlPolicy urlPolicy;

    public DestinationConfigValidator(WebhookUrlPolicy urlPolicy) {
        this.urlPolicy = Objects.requireNonNull(urlPolicy, "urlPolicy");
    }

    public WebhookUrlPolicy urlPolicy() {
        return urlPolicy;
    }

    /**
     * @return the config with its webhook URL trimmed
     * @throws ConfigValidationException if any field is rejected
     */
    public DestinationConfig validate(DestinationConfig config) {
        if (!DESTINATION_ID.matcher(config.destinationId()).matches()) {
            throw new ConfigValidationException("destinationId",
                    "must be 1 to 64 characters of letters, digits, '-' or '_'");
        }
        urlPolicy.check(config.webhookUrl());
        if (config.maxMediaBytes() <= 0) {
            throw new ConfigValidationException("maxMediaBytes", "must be > 0");
        }
        validateWatermark(config.watermark());
        String trimmed = config.webhookUrl().trim();
        return trimmed.equals(config.webhookUrl()) ? config : config.toBuilder().webhookUrl(trimmed).build();
    }

    private static void validateWatermark(WatermarkConfig w) {
        if (w.mode().includesOverlay() && (w.overlayPath() == null || w.overlayPath().isBlank())) {
            throw new ConfigValidationException("watermark.overlayPath",
                    "required for mode " + w.mode().code());
        }
        if (w.fontSize() <= 0) {
            throw new ConfigValidationException("watermark.fontSize", "must be > 0");
        }
        if (w.outlineWidth() < 0) {
            throw new ConfigValidationException("watermark.outlineWidth", "must be >= 0");
        }
        if (!WatermarkColors.isValid(w.fillColor())) {
            throw new ConfigValidationException("watermark.fillColor", "must be #RRGGBB or #RRGGBBAA");
        }
        if (!WatermarkColors.isValid(w.outlineColor())) {
            throw new ConfigValidationException("watermark.outlineColor", "must be #RRGGBB or #RRGGBBAA");
        }
        if (w.maxMediaBytes() <= 0) {
            throw new ConfigValidationException("watermark.maxMediaBytes", "must be > 0");
        }
        if (w.videoQuality() < 0 || w.videoQuality() > 51) {
            throw new ConfigValidationException("watermark.videoQuality", "must be within [0, 51]");
        }
        if (w.videoTimeout().isZero() || w.videoTimeout().isNegative()) {
            throw new ConfigValidationException("watermark.videoTimeout", "must be positive");
        }
    }
}
