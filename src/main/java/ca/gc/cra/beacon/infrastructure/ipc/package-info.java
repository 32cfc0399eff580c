/**
 * Local IPC adapters: UNIX-domain socket listener, producer client, and the length-prefixed frame codec.
 * <p><strong>Concurrency:</strong> One accept thread; one pooled thread per live connection.</p>
 * <p><strong>Security:</strong> The socket is world-writable so any local producer can connect; payloads are never logged.</p>
 */
package ca.gc.cra.beacon.infrastructure.ipc;
