/**
 * The single read-and-dispatch loop and its backoff policy.
 *
 * @see fanout.puller.Puller
 */
package fanout.puller;
