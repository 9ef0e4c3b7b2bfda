/**
 * Archival of finished sessions.
 *
 * <p>The finalizer hands the full-session container to the active
 * {@link com.phillippitts.streamscribe.service.archive.ObjectStore} on the archive executor.
 * Failures are logged and published as events; they are never retried and never reach the client.
 */
package com.phillippitts.streamscribe.service.archive;
