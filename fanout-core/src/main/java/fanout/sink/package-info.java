/**
 * Bounded, non-blocking channels between the puller and attached consumers.
 */
package fanout.sink;
