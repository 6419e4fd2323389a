/**
 * Source ingestion: the event stream contract, duplicate suppression, and the loop that
 * hands each message to transform and delivery.
 */
package relay.ingest;
