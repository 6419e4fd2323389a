/**
 * Immutable value types shared by every relay component: destination settings,
 * watermark settings, content filters, and the inbound/outbound message shapes.
 */
package relay.model;
