/**
 * Per-category pending-record queues.
 */
package writebuffer.buffer;
