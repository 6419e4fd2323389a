/**
 * Per-destination message transforms: caption text, image overlay and text watermarks,
 * JPEG compression under a size cap, and video watermarking through {@code ffmpeg}.
 *
 * @see relay.transform.WatermarkEngine
 * @see relay.transform.PositionCalculator
 */
package relay.transform;
