package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.lock.VersionStamp;

/**
 * Bytes used by an owner, with the version to pass back to
 * {@link StorageFacade#adjustQuota(String, VersionStamp, long)}.
 */
public record QuotaSnapshot(String ownerId, long usedBytes, VersionStamp version) {}
