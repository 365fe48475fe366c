/**
 * Storage seam of the PostRelay platform.
 *
 * <p>The storage engine itself is external; this package defines how its handles are opened
 * ({@link com.postrelay.storage.StorageOpener}) and keeps them confined to the thread that opened
 * them ({@link com.postrelay.storage.ThreadAffineHandleCache}).
 */
package com.postrelay.storage;
