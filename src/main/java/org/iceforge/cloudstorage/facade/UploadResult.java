package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.lock.VersionStamp;
import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;
import org.iceforge.cloudstorage.upload.strategy.UploadStrategy;

public record UploadResult(FinalObjectDescriptor descriptor, VersionStamp version, UploadStrategy.Kind strategy) {}
