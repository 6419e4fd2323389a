/**
 * Small shared helpers with no relay semantics of their own.
 */
package relay.util;
