/**
 * Message relay: replicates source messages to destination webhooks with per-destination
 * watermarking, retry, circuit breaking and statistics.
 *
 * <p>{@link relay.Relay} wires the pieces together; {@link relay.RelayAdmin} exposes
 * destination management and health to an admin layer.
 */
package relay;
