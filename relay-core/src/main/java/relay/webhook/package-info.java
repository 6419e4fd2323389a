/**
 * Webhook endpoint access: URL policy, redaction, the HTTP transport, and the validator
 * used by the admin layer to test a URL before storing it.
 *
 * @see relay.webhook.WebhookTransport
 * @see relay.webhook.WebhookValidator
 */
package relay.webhook;
