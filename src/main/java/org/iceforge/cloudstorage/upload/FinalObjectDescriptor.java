package org.iceforge.cloudstorage.upload;

/**
 * The object as the store holds it after a successful upload.
 */
public record FinalObjectDescriptor(String path, String eTag, String versionId, long size, int partCount) {}
