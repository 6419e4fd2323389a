/**
 * In-process counters for messages seen, replicated, transformed and failed, with
 * per-destination delivery breakdowns.
 */
package relay.stats;
